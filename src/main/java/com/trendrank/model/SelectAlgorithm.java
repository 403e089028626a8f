package com.trendrank.model;

public enum SelectAlgorithm {
    SEQUENTIAL("Sequential (Heap)", "O(n log k)", false),
    QUICK_SELECT("Quick Select", "O(n) avg, O(n^2) worst", false),
    BINARY_PARTITION("Binary Select", "O(n log range)", true),
    NTH_ELEMENT("Nth Element", "O(n) avg", false);

    private final String displayName;
    private final String complexity;
    private final boolean integralOnly;

    SelectAlgorithm(String displayName, String complexity, boolean integralOnly) {
        this.displayName = displayName;
        this.complexity = complexity;
        this.integralOnly = integralOnly;
    }

    public String displayName() {
        return displayName;
    }

    public String complexity() {
        return complexity;
    }

    public boolean isIntegralOnly() {
        return integralOnly;
    }
}

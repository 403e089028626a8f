package com.trendrank.model;

public enum SortAlgorithm {
    SELECTION("Selection Sort", "O(n^2)", false),
    INSERTION("Insertion Sort", "O(n^2)", false),
    BUBBLE("Bubble Sort", "O(n^2)", false),
    QUICK("Quick Sort", "O(n log n) avg", false),
    MERGE("Merge Sort", "O(n log n)", false),
    SHELL("Shell Sort", "O(n^1.5)", false),
    HEAP("Heap Sort", "O(n log n)", false),
    COUNTING("Counting Sort", "O(n + r)", true),
    RADIX("Radix Sort", "O(d * n)", true);

    private final String displayName;
    private final String complexity;
    private final boolean integralOnly;

    SortAlgorithm(String displayName, String complexity, boolean integralOnly) {
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

    /** Counting and radix sort only work on raw integral values, never on composite keys. */
    public boolean isIntegralOnly() {
        return integralOnly;
    }
}

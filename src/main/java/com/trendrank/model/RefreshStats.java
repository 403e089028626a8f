package com.trendrank.model;

/**
 * Counters describing what an incremental refresh changed.
 * Rebuilding strategies report {@link #rebuilt(int)}.
 */
public record RefreshStats(int removed, int updated, int inserted, int reusedSlots, boolean compacted,
        boolean fullRebuild) {

    public static RefreshStats rebuilt(int size) {
        return new RefreshStats(0, 0, size, 0, false, true);
    }

    public static RefreshStats incremental(int removed, int updated, int inserted, int reusedSlots,
            boolean compacted) {
        return new RefreshStats(removed, updated, inserted, reusedSlots, compacted, false);
    }
}

package com.fixguard.core.escalation;

/**
 * Snapshot of the escalation queue. Average and high-priority count cover active items only.
 */
public final class QueueStats {

    private final int    totalCount;
    private final int    activeCount;
    private final int    resolvedCount;
    private final double avgPriority;
    private final int    highPriorityCount;

    public QueueStats(int totalCount, int activeCount, int resolvedCount,
                      double avgPriority, int highPriorityCount) {
        this.totalCount        = totalCount;
        this.activeCount       = activeCount;
        this.resolvedCount     = resolvedCount;
        this.avgPriority       = avgPriority;
        this.highPriorityCount = highPriorityCount;
    }

    public int    getTotalCount()        { return totalCount; }
    public int    getActiveCount()       { return activeCount; }
    public int    getResolvedCount()     { return resolvedCount; }
    public double getAvgPriority()       { return avgPriority; }
    public int    getHighPriorityCount() { return highPriorityCount; }
}

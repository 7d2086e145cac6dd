package com.fixguard.core.regression;

/**
 * Pure comparison of two regression snapshots.
 *
 * new_failures = max(0, after.failed - baseline.failed), improved = after.failed < baseline.failed.
 * Two runs with the same failure count but different failing tests compare as zero
 * new failures.
 */
public final class RegressionComparator {

    private RegressionComparator() {
    }

    public static Comparison compare(RegressionSnapshot baseline, RegressionSnapshot after) {
        return new Comparison(
                baseline.getPassed(),
                baseline.getFailed(),
                after.getPassed(),
                after.getFailed()
        );
    }
}

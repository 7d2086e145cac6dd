package com.fixguard.core.regression;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Derived result of comparing a baseline snapshot with an after-fix snapshot.
 * Only failure counts are compared, not the identity of the failing tests.
 */
public final class Comparison {

    private final int     newFailures;
    private final boolean improved;
    private final int     baselinePassed;
    private final int     baselineFailed;
    private final int     afterPassed;
    private final int     afterFailed;

    public Comparison(
            int baselinePassed,
            int baselineFailed,
            int afterPassed,
            int afterFailed
    ) {
        this.baselinePassed = baselinePassed;
        this.baselineFailed = baselineFailed;
        this.afterPassed    = afterPassed;
        this.afterFailed    = afterFailed;
        this.newFailures    = Math.max(0, afterFailed - baselineFailed);
        this.improved       = afterFailed < baselineFailed;
    }

    public int     getNewFailures()    { return newFailures; }
    public boolean isImproved()        { return improved; }
    public int     getBaselinePassed() { return baselinePassed; }
    public int     getBaselineFailed() { return baselineFailed; }
    public int     getAfterPassed()    { return afterPassed; }
    public int     getAfterFailed()    { return afterFailed; }

    /** Zero new failures: the fix may stay in place. */
    @JsonIgnore
    public boolean isInvariantHonored() {
        return newFailures == 0;
    }

    @Override
    public String toString() {
        return String.format(
            "Comparison{baseline=%d/%d, after=%d/%d, newFailures=%d, improved=%s}",
            baselinePassed, baselineFailed, afterPassed, afterFailed, newFailures, improved
        );
    }
}

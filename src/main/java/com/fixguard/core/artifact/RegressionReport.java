package com.fixguard.core.artifact;

import com.fixguard.core.regression.Comparison;
import com.fixguard.core.regression.RegressionSnapshot;

import java.time.Instant;

/**
 * Content of regression_report_&lt;timestamp&gt;.json.
 */
public final class RegressionReport {

    /** Counts only; raw runner output stays out of the audit file. */
    public static final class Counts {
        private final int passed;
        private final int failed;
        private final int total;

        Counts(RegressionSnapshot snapshot) {
            this.passed = snapshot.getPassed();
            this.failed = snapshot.getFailed();
            this.total  = snapshot.getTotal();
        }

        public int getPassed() { return passed; }
        public int getFailed() { return failed; }
        public int getTotal()  { return total; }
    }

    private final Instant    timestamp;
    private final String     testPath;
    private final String     diagnosis;
    private final Counts     baseline;
    private final Counts     afterFix;
    private final Comparison comparison;
    private final boolean    fixApplied;
    private final boolean    invariantHonored;

    public RegressionReport(
            Instant            timestamp,
            String             testPath,
            String             diagnosis,
            RegressionSnapshot baseline,
            RegressionSnapshot afterFix,
            Comparison         comparison
    ) {
        this.timestamp        = timestamp;
        this.testPath         = testPath;
        this.diagnosis        = diagnosis;
        this.baseline         = new Counts(baseline);
        this.afterFix         = new Counts(afterFix);
        this.comparison       = comparison;
        this.fixApplied       = comparison.isInvariantHonored();
        this.invariantHonored = comparison.isInvariantHonored();
    }

    public Instant    getTimestamp()       { return timestamp; }
    public String     getTestPath()        { return testPath; }
    public String     getDiagnosis()       { return diagnosis; }
    public Counts     getBaseline()        { return baseline; }
    public Counts     getAfterFix()        { return afterFix; }
    public Comparison getComparison()      { return comparison; }
    public boolean    isFixApplied()       { return fixApplied; }
    public boolean    isInvariantHonored() { return invariantHonored; }
}

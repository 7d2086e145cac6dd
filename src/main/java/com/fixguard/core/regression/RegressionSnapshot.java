package com.fixguard.core.regression;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Pass/fail snapshot of one regression-suite run. Immutable.
 *
 * A snapshot is only usable for comparison when the suite actually ran to completion:
 * {@link #isUsable()} is false for timed-out runs and for runs that produced no
 * parseable summary (missing runner binary, crashed reporter, ...).
 */
public class RegressionSnapshot {

    private final int          passed;
    private final int          failed;
    private final int          total;
    private final List<String> errors;
    private final String       rawOutput;
    private final boolean      timedOut;
    private final boolean      ran;
    private final int          exitCode;

    public RegressionSnapshot(
            int          passed,
            int          failed,
            List<String> errors,
            String       rawOutput,
            int          exitCode
    ) {
        this(passed, failed, errors, rawOutput, false, true, exitCode);
    }

    private RegressionSnapshot(
            int          passed,
            int          failed,
            List<String> errors,
            String       rawOutput,
            boolean      timedOut,
            boolean      ran,
            int          exitCode
    ) {
        this.passed    = passed;
        this.failed    = failed;
        this.total     = passed + failed;
        this.errors    = errors != null ? List.copyOf(errors) : List.of();
        this.rawOutput = rawOutput != null ? rawOutput : "";
        this.timedOut  = timedOut;
        this.ran       = ran;
        this.exitCode  = exitCode;
    }

    /** The runner was killed after exceeding its timeout. */
    public static RegressionSnapshot timedOut(String partialOutput, long timeoutSeconds) {
        return new RegressionSnapshot(0, 0,
                List.of("Regression tests timed out after " + timeoutSeconds + "s"),
                partialOutput, true, false, -1);
    }

    /** The runner could not be started or produced no result. */
    public static RegressionSnapshot notRun(String reason) {
        return new RegressionSnapshot(0, 0, List.of(reason), reason, false, false, -2);
    }

    /** Convenience for callers that already know the counts. */
    public static RegressionSnapshot of(int passed, int failed) {
        return new RegressionSnapshot(passed, failed, List.of(), "", failed > 0 ? 1 : 0);
    }

    public int          getPassed()    { return passed; }
    public int          getFailed()    { return failed; }
    public int          getTotal()     { return total; }
    public List<String> getErrors()    { return errors; }
    public String       getRawOutput() { return rawOutput; }
    public boolean      isTimedOut()   { return timedOut; }
    public boolean      isRan()        { return ran; }
    public int          getExitCode()  { return exitCode; }

    @JsonIgnore
    public boolean isUsable() {
        return ran && !timedOut;
    }

    /** First error line, used as the human-readable reason of an unusable run. */
    @JsonIgnore
    public String getFailureReason() {
        if (isUsable()) return null;
        return errors.isEmpty() ? "Regression run produced no result" : errors.get(0);
    }

    public String getSummary() {
        if (timedOut) return "Regression run timed out";
        if (!ran)     return "Regression run did not complete";
        return passed + " passed, " + failed + " failed";
    }

    @Override
    public String toString() {
        return getSummary();
    }
}

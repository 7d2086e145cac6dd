package com.fixguard.core.fix;

import com.fixguard.core.artifact.ArtifactPaths;
import com.fixguard.core.escalation.EscalationItem;
import com.fixguard.core.proposal.FixProposal;
import com.fixguard.core.regression.Comparison;

/**
 * Terminal result of one fix pass. Every result carries the generation cost incurred,
 * including on failure paths.
 */
public final class FixResult {

    private final FixOutcome     outcome;
    private final String         reason;
    private final FailureKind    failureKind;
    private final String         taskId;
    private final String         testPath;
    private final String         diagnosis;
    private final Double         confidence;
    private final Comparison     comparison;
    private final ArtifactPaths  artifacts;
    private final EscalationItem escalation;
    private final boolean        queued;
    private final int            attempts;
    private final double         costUsd;
    private final long           elapsedMs;

    // Not serialized; kept so withElapsedMs can rebuild the result
    private final FixTask        task;
    private final FixProposal    proposal;

    private FixResult(
            FixOutcome     outcome,
            String         reason,
            FailureKind    failureKind,
            FixTask        task,
            FixProposal    proposal,
            Comparison     comparison,
            ArtifactPaths  artifacts,
            EscalationItem escalation,
            boolean        queued,
            double         costUsd,
            long           elapsedMs
    ) {
        this.outcome     = outcome;
        this.reason      = reason;
        this.failureKind = failureKind;
        this.taskId      = task.getTaskId();
        this.testPath    = task.getTestPath();
        this.diagnosis   = proposal != null ? proposal.getDiagnosis() : null;
        this.confidence  = proposal != null ? proposal.getConfidence() : null;
        this.comparison  = comparison;
        this.artifacts   = artifacts;
        this.escalation  = escalation;
        this.queued      = queued;
        this.attempts    = task.getAttemptCount();
        this.costUsd     = costUsd;
        this.elapsedMs   = elapsedMs;
        this.task        = task;
        this.proposal    = proposal;
    }

    // ================================================================
    // Factories
    // ================================================================

    public static FixResult applied(FixTask task, FixProposal proposal, Comparison comparison,
                                    ArtifactPaths artifacts, double costUsd) {
        String reason = "Fix applied: " + proposal.getDiagnosis() + " (" + comparison.getNewFailures()
                + " new failures)";
        return new FixResult(FixOutcome.FIX_APPLIED, reason, null, task, proposal,
                comparison, artifacts, null, false, costUsd, 0L);
    }

    public static FixResult escalated(FixTask task, String reason, FixProposal proposal, Comparison comparison,
                                      ArtifactPaths artifacts, EscalationItem escalation, boolean queued,
                                      double costUsd) {
        return new FixResult(FixOutcome.ESCALATED, reason, null, task, proposal,
                comparison, artifacts, escalation, queued, costUsd, 0L);
    }

    public static FixResult aborted(FixTask task, FailureKind kind, String reason,
                                    FixProposal proposal, double costUsd) {
        return new FixResult(FixOutcome.ABORTED, reason, kind, task, proposal,
                null, null, null, false, costUsd, 0L);
    }

    public FixResult withElapsedMs(long elapsed) {
        return new FixResult(outcome, reason, failureKind, task, proposal, comparison,
                artifacts, escalation, queued, costUsd, elapsed);
    }

    // ================================================================
    // Accessors
    // ================================================================

    public boolean isSuccess() { return outcome == FixOutcome.FIX_APPLIED; }

    public FixOutcome     getOutcome()     { return outcome; }
    public String         getReason()      { return reason; }
    public FailureKind    getFailureKind() { return failureKind; }
    public String         getTaskId()      { return taskId; }
    public String         getTestPath()    { return testPath; }
    public String         getDiagnosis()   { return diagnosis; }
    public Double         getConfidence()  { return confidence; }
    public Comparison     getComparison()  { return comparison; }
    public ArtifactPaths  getArtifacts()   { return artifacts; }
    public EscalationItem getEscalation()  { return escalation; }
    public boolean        isQueued()       { return queued; }
    public int            getAttempts()    { return attempts; }
    public double         getCostUsd()     { return costUsd; }
    public long           getElapsedMs()   { return elapsedMs; }

    @Override
    public String toString() {
        return String.format("FixResult{%s%s, task=%s, attempts=%d, cost=$%.4f, %dms: %s}",
                outcome, failureKind != null ? "/" + failureKind : "", taskId, attempts, costUsd, elapsedMs, reason);
    }
}

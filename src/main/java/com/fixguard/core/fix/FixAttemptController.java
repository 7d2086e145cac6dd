package com.fixguard.core.fix;

import com.fixguard.core.artifact.ArtifactPaths;
import com.fixguard.core.artifact.ArtifactWriter;
import com.fixguard.core.artifact.DiffGenerator;
import com.fixguard.core.artifact.RegressionReport;
import com.fixguard.core.attempt.AttemptRecord;
import com.fixguard.core.attempt.AttemptTracker;
import com.fixguard.core.escalation.EscalationItem;
import com.fixguard.core.escalation.EscalationPriority;
import com.fixguard.core.escalation.EscalationQueue;
import com.fixguard.core.escalation.EscalationReason;
import com.fixguard.core.escalation.Severity;
import com.fixguard.core.filesystem.FileSystemManager;
import com.fixguard.core.filesystem.FileSystemManager.FileSnapshot;
import com.fixguard.core.filesystem.FileSystemManager.FileSystemException;
import com.fixguard.core.proposal.ContextGatherer;
import com.fixguard.core.proposal.FixContext;
import com.fixguard.core.proposal.FixProposal;
import com.fixguard.core.proposal.GeneratedProposal;
import com.fixguard.core.proposal.ProposalGenerationException;
import com.fixguard.core.proposal.ProposalGenerator;
import com.fixguard.core.proposal.ProposalParseException;
import com.fixguard.core.proposal.ProposalParser;
import com.fixguard.core.regression.Comparison;
import com.fixguard.core.regression.RegressionComparator;
import com.fixguard.core.regression.RegressionRunner;
import com.fixguard.core.regression.RegressionSnapshot;
import com.fixguard.core.store.StoreUnavailableException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level controller of the fix engine: one bounded, regression-checked fix pass
 * per call.
 *
 * Phase flow (see {@link FixPhase}):
 *   ATTEMPT_CHECK → BASELINE_CAPTURE → PROPOSAL_GENERATION → CONFIDENCE_GATE
 *   → APPLY → POST_FIX_REGRESSION → COMPARE
 *
 * Guarantees:
 *   - No fix stays in place if the regression suite shows more failures than before it.
 *   - A rolled-back file is byte-identical to its pre-fix content.
 *   - Nothing escapes attemptFix: every failure becomes a FixResult.
 *
 * Concurrent calls for the same test file are not serialized here; callers must do that.
 */
@Component
public class FixAttemptController {

    private static final Logger log = LoggerFactory.getLogger(FixAttemptController.class);

    static final int MAX_DIFF_CHARS         = 2000;
    static final int MAX_PROPOSED_FIX_CHARS = 500;

    private final AttemptTracker    attemptTracker;
    private final RegressionRunner  regressionRunner;
    private final FileSystemManager fileSystem;
    private final ContextGatherer   contextGatherer;
    private final ProposalGenerator proposalGenerator;
    private final ProposalParser    proposalParser;
    private final DiffGenerator     diffGenerator;
    private final ArtifactWriter    artifactWriter;
    private final EscalationQueue   escalationQueue;
    private final EscalationPolicy  escalationPolicy;
    private final Clock             clock;

    private final int          maxRetries;
    private final double       confidenceThreshold;
    private final List<String> regressionSuite;

    public FixAttemptController(
            AttemptTracker    attemptTracker,
            RegressionRunner  regressionRunner,
            FileSystemManager fileSystem,
            ContextGatherer   contextGatherer,
            ProposalGenerator proposalGenerator,
            ProposalParser    proposalParser,
            DiffGenerator     diffGenerator,
            ArtifactWriter    artifactWriter,
            EscalationQueue   escalationQueue,
            EscalationPolicy  escalationPolicy,
            Clock             clock,
            @Value("${fixguard.fix.max-retries:3}")            int    maxRetries,
            @Value("${fixguard.fix.confidence-threshold:0.7}") double confidenceThreshold,
            @Value("${fixguard.regression.suite:tests/auth.spec.ts,tests/core_nav.spec.ts}")
            List<String> regressionSuite
    ) {
        this.attemptTracker      = attemptTracker;
        this.regressionRunner    = regressionRunner;
        this.fileSystem          = fileSystem;
        this.contextGatherer     = contextGatherer;
        this.proposalGenerator   = proposalGenerator;
        this.proposalParser      = proposalParser;
        this.diffGenerator       = diffGenerator;
        this.artifactWriter      = artifactWriter;
        this.escalationQueue     = escalationQueue;
        this.escalationPolicy    = escalationPolicy;
        this.clock               = clock;
        this.maxRetries          = maxRetries;
        this.confidenceThreshold = confidenceThreshold;
        this.regressionSuite     = List.copyOf(regressionSuite);

        log.info("[FixController] maxRetries={} threshold={} suite={} {}",
                maxRetries, confidenceThreshold, this.regressionSuite, escalationPolicy);
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    /**
     * Runs one fix pass.
     *
     * @param taskId  stable id across retries of the same failure; generated when null
     * @param feature feature description for prioritisation; defaults to the test file stem
     */
    public FixResult attemptFix(String testPath, String errorMessage, String taskId, String feature) {

        long    startTime = System.currentTimeMillis();
        FixTask task      = FixTask.create(testPath, errorMessage, taskId, feature, clock);

        log.info("========== FIX ATTEMPT START {} ==========", task.getTaskId());

        FixResult result = runPass(task).withElapsedMs(System.currentTimeMillis() - startTime);
        log.info("========== FIX ATTEMPT END: {} ==========", result);
        return result;
    }

    // =========================================================================
    // PHASES
    // =========================================================================

    private FixResult runPass(FixTask task) {

        // ---------------------------------------------------------------------
        // ATTEMPT_CHECK
        // ---------------------------------------------------------------------
        enter(FixPhase.ATTEMPT_CHECK, task);
        int attempts;
        try {
            attempts = attemptTracker.increment(task.getTaskId(), task.getTestPath());
        } catch (StoreUnavailableException e) {
            log.error("[FixController] Attempt tracking unavailable: {}", e.getMessage());
            return FixResult.aborted(task, FailureKind.STORE_UNAVAILABLE,
                    "Attempt tracking unavailable: " + e.getMessage(), null, 0.0);
        }
        task = task.withAttemptCount(attempts);
        log.info("[FixController] {} attempt {}/{}", task.getTaskId(), attempts, maxRetries);

        if (attempts > maxRetries) {
            String reason = "Max retries (" + maxRetries + ") exceeded";
            if (!escalationPolicy.isEnabled()) {
                log.warn("[FixController] {} in unattended mode, not escalating", reason);
                return FixResult.aborted(task, FailureKind.MAX_RETRIES_EXCEEDED, reason, null, 0.0);
            }
            return escalate(task, EscalationReason.MAX_RETRIES_EXCEEDED, reason,
                    null, null, null, null, null, null, 0.0);
        }

        // ---------------------------------------------------------------------
        // BASELINE_CAPTURE
        // ---------------------------------------------------------------------
        enter(FixPhase.BASELINE_CAPTURE, task);
        RegressionSnapshot baseline = runSuite();
        if (!baseline.isUsable()) {
            log.error("[FixController] Baseline capture failed: {}", baseline.getFailureReason());
            return FixResult.aborted(task, FailureKind.BASELINE_CAPTURE_FAILURE,
                    "Baseline capture failed: " + baseline.getFailureReason(), null, 0.0);
        }
        log.info("[FixController] Baseline: {}", baseline.getSummary());

        // ---------------------------------------------------------------------
        // PROPOSAL_GENERATION
        // ---------------------------------------------------------------------
        enter(FixPhase.PROPOSAL_GENERATION, task);
        FileSnapshot original;
        try {
            original = fileSystem.snapshotFile(task.getTestPath());
        } catch (FileSystemException e) {
            log.error("[FixController] Cannot read {}: {}", task.getTestPath(), e.getMessage());
            return FixResult.aborted(task, FailureKind.FILE_ACCESS_FAILURE,
                    "Failed to read test file: " + e.getMessage(), null, 0.0);
        }
        String originalText = original.asText();

        FixContext context = contextGatherer.gather(task.getTestPath(), originalText, task.getErrorMessage());

        GeneratedProposal generated;
        try {
            generated = proposalGenerator.propose(context);
        } catch (ProposalGenerationException e) {
            return FixResult.aborted(task, FailureKind.PROPOSAL_GENERATION_FAILURE,
                    e.getMessage(), null, e.getCostUsd());
        } catch (RuntimeException e) {
            log.error("[FixController] Proposal generator failed: {}", e.getMessage());
            return FixResult.aborted(task, FailureKind.PROPOSAL_GENERATION_FAILURE,
                    "AI fix generation failed: " + e.getMessage(), null, 0.0);
        }
        double cost = generated.getCostUsd();

        FixProposal proposal;
        try {
            proposal = proposalParser.parse(generated.getRawText());
        } catch (ProposalParseException e) {
            log.error("[FixController] Unusable proposal: {}", e.getMessage());
            return FixResult.aborted(task, FailureKind.PROPOSAL_PARSE_FAILURE, e.getMessage(), null, cost);
        }

        String diff = diffGenerator.unifiedDiff(originalText, proposal.getFixedContent(), task.getTestPath());

        // ---------------------------------------------------------------------
        // CONFIDENCE_GATE
        // ---------------------------------------------------------------------
        enter(FixPhase.CONFIDENCE_GATE, task);
        if (proposal.getConfidence() < confidenceThreshold) {
            if (escalationPolicy.isEnabled()) {
                String reason = String.format("Low confidence (%.2f < %.2f)",
                        proposal.getConfidence(), confidenceThreshold);
                return escalate(task, EscalationReason.LOW_CONFIDENCE, reason,
                        proposal, diff, null, null, null, null, cost);
            }
            log.warn("[FixController] Confidence {} below {} in unattended mode, applying anyway",
                    proposal.getConfidence(), confidenceThreshold);
        }

        // ---------------------------------------------------------------------
        // APPLY
        // ---------------------------------------------------------------------
        enter(FixPhase.APPLY, task);
        try {
            fileSystem.writeFile(task.getTestPath(), proposal.getFixedContent());
        } catch (FileSystemException e) {
            log.error("[FixController] Failed to apply fix: {}", e.getMessage());
            if (!rollback(original)) {
                return escalate(task, EscalationReason.ROLLBACK_FAILED,
                        "Failed to apply fix and failed to restore the original file",
                        proposal, diff, baseline, null, null, null, cost);
            }
            return FixResult.aborted(task, FailureKind.FILE_ACCESS_FAILURE,
                    "Failed to apply fix: " + e.getMessage(), proposal, cost);
        }
        log.info("[FixController] Applied fix to {}: {}", task.getTestPath(), proposal.getDiagnosis());

        // ---------------------------------------------------------------------
        // POST_FIX_REGRESSION
        // ---------------------------------------------------------------------
        enter(FixPhase.POST_FIX_REGRESSION, task);
        RegressionSnapshot afterFix = runSuite();
        if (!afterFix.isUsable()) {
            log.error("[FixController] Post-fix run failed: {}", afterFix.getFailureReason());
            if (!rollback(original)) {
                return escalate(task, EscalationReason.ROLLBACK_FAILED,
                        "Post-fix regression run failed and the original file could not be restored",
                        proposal, diff, baseline, afterFix, null, null, cost);
            }
            return FixResult.aborted(task, FailureKind.POST_FIX_RUN_FAILURE,
                    "Post-fix regression run failed: " + afterFix.getFailureReason()
                            + "; original file restored", proposal, cost);
        }
        log.info("[FixController] After fix: {}", afterFix.getSummary());

        // ---------------------------------------------------------------------
        // COMPARE
        // ---------------------------------------------------------------------
        enter(FixPhase.COMPARE, task);
        Comparison comparison = RegressionComparator.compare(baseline, afterFix);
        log.info("[FixController] {}", comparison);

        ArtifactPaths artifacts = writeArtifacts(task, proposal, diff, baseline, afterFix, comparison);

        if (comparison.getNewFailures() > 0) {
            log.warn("[FixController] {} new failure(s), rolling back {}",
                    comparison.getNewFailures(), task.getTestPath());
            if (!rollback(original)) {
                return escalate(task, EscalationReason.ROLLBACK_FAILED,
                        "Fix introduced " + comparison.getNewFailures()
                                + " new failure(s) and the original file could not be restored",
                        proposal, diff, baseline, afterFix, comparison, artifacts, cost);
            }
            return escalate(task, EscalationReason.REGRESSION_DETECTED,
                    "Fix introduced " + comparison.getNewFailures() + " new failure(s); original file restored",
                    proposal, diff, baseline, afterFix, comparison, artifacts, cost);
        }

        return FixResult.applied(task, proposal, comparison, artifacts, cost);
    }

    // =========================================================================
    // ESCALATION
    // =========================================================================

    private FixResult escalate(
            FixTask            task,
            EscalationReason   escalationReason,
            String             reason,
            FixProposal        proposal,
            String             diff,
            RegressionSnapshot baseline,
            RegressionSnapshot afterFix,
            Comparison         comparison,
            ArtifactPaths      artifacts,
            double             cost
    ) {
        Instant  now      = clock.instant();
        Severity severity = escalationReason.getDefaultSeverity();

        EscalationItem item = new EscalationItem(task.getTaskId());
        item.setFeature(task.getFeature());
        item.setCodePath(task.getTestPath());
        item.setLogsPath(artifactWriter.logsPathFor(task.getTaskId()));
        item.setScreenshots(artifactWriter.findScreenshots(task.getTestPath()));
        item.setAttempts(task.getAttemptCount());
        item.setLastError(task.getErrorMessage());
        item.setSeverity(severity);
        item.setEscalationReason(escalationReason);
        item.setAttemptHistory(attemptHistory(task.getTaskId()));
        item.setCreatedAt(now);
        item.setPriority(EscalationPriority.computePriority(
                severity, task.getAttemptCount(), task.getFeature(), now, now));

        if (proposal != null) {
            item.setAiDiagnosis(proposal.getDiagnosis());
            item.setAiConfidence(proposal.getConfidence());
        }

        Map<String, String> payload = new LinkedHashMap<>();
        if (diff != null)       payload.put("diff", truncate(diff, MAX_DIFF_CHARS));
        if (proposal != null)   payload.put("proposed_fix", truncate(proposal.getFixedContent(), MAX_PROPOSED_FIX_CHARS));
        if (baseline != null)   payload.put("baseline", baseline.getSummary());
        if (afterFix != null)   payload.put("after_fix", afterFix.getSummary());
        if (comparison != null) payload.put("comparison", comparison.toString());
        if (artifacts != null) {
            payload.put("diff_path",   artifacts.getDiffPath());
            payload.put("report_path", artifacts.getReportPath());
        }
        item.setArtifacts(payload);

        boolean queued;
        try {
            queued = escalationQueue.add(item);
        } catch (RuntimeException e) {
            log.error("[FixController] Failed to queue escalation for {}: {}", task.getTaskId(), e.getMessage());
            queued = false;
        }

        log.warn("[FixController] Escalated {} ({}, {}, priority {}): {}",
                task.getTaskId(), escalationReason.code(), severity.code(),
                String.format("%.2f", item.getPriority()), reason);

        return FixResult.escalated(task, "Escalated: " + reason, proposal, comparison,
                artifacts, item, queued, cost);
    }

    private List<AttemptRecord> attemptHistory(String taskId) {
        try {
            return attemptTracker.history(taskId);
        } catch (StoreUnavailableException e) {
            log.warn("[FixController] Attempt history unavailable for {}: {}", taskId, e.getMessage());
            return List.of();
        }
    }

    // =========================================================================
    // HELPERS
    // =========================================================================

    private void enter(FixPhase phase, FixTask task) {
        log.info("[FixController] {} phase={}", task.getTaskId(), phase);
    }

    private RegressionSnapshot runSuite() {
        try {
            return regressionRunner.run(regressionSuite);
        } catch (RuntimeException e) {
            log.error("[FixController] Regression runner failed: {}", e.getMessage());
            return RegressionSnapshot.notRun("Regression runner failed: " + e.getMessage());
        }
    }

    private boolean rollback(FileSnapshot original) {
        try {
            fileSystem.restoreFile(original);
            return true;
        } catch (FileSystemException e) {
            log.error("[FixController] ROLLBACK FAILED for {}: {}", original.getRelativePath(), e.getMessage());
            return false;
        }
    }

    private ArtifactPaths writeArtifacts(FixTask task, FixProposal proposal, String diff,
                                         RegressionSnapshot baseline, RegressionSnapshot afterFix,
                                         Comparison comparison) {
        RegressionReport report = new RegressionReport(clock.instant(), task.getTestPath(),
                proposal.getDiagnosis(), baseline, afterFix, comparison);
        try {
            return artifactWriter.write(diff, report);
        } catch (IOException e) {
            log.error("[FixController] Could not write audit artifacts: {}", e.getMessage());
            return null;
        }
    }

    private static String truncate(String text, int max) {
        if (text == null) return null;
        return text.length() <= max ? text : text.substring(0, max);
    }
}

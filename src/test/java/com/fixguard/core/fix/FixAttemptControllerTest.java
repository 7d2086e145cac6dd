package com.fixguard.core.fix;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixguard.MutableClock;
import com.fixguard.config.FixGuardConfig;
import com.fixguard.core.artifact.ArtifactWriter;
import com.fixguard.core.artifact.DiffGenerator;
import com.fixguard.core.attempt.AttemptTracker;
import com.fixguard.core.escalation.EscalationItem;
import com.fixguard.core.escalation.EscalationQueue;
import com.fixguard.core.escalation.EscalationReason;
import com.fixguard.core.escalation.Severity;
import com.fixguard.core.filesystem.FileSystemManager;
import com.fixguard.core.learning.LearningStore;
import com.fixguard.core.proposal.ContextGatherer;
import com.fixguard.core.proposal.FixContext;
import com.fixguard.core.proposal.GeneratedProposal;
import com.fixguard.core.proposal.ProposalGenerationException;
import com.fixguard.core.proposal.ProposalGenerator;
import com.fixguard.core.proposal.ProposalParser;
import com.fixguard.core.regression.RegressionSnapshot;
import com.fixguard.core.store.InMemoryKeyValueStore;
import com.fixguard.core.store.StoreUnavailableException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class FixAttemptControllerTest {

    private static final String TEST_PATH = "tests/login.spec.ts";
    private static final String ERROR     = "locator('[data-testid=\"login-btn\"]') not found";

    private static final String ORIGINAL = """
            test('login', async ({ page }) => {\r
              await page.click('[data-testid="login-btn"]');\r
            });\r
            """;

    private static final String FIXED = """
            test('login', async ({ page }) => {
              await page.click('[data-testid="login-button"]');
            });
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper               objectMapper = FixGuardConfig.createObjectMapper();
    private final Deque<RegressionSnapshot>  runs         = new ArrayDeque<>();

    private int                   runnerCalls;
    private MutableClock          clock;
    private FileSystemManager     fileSystem;
    private AttemptTracker        tracker;
    private EscalationQueue       queue;
    private FixContext            lastContext;

    @BeforeEach
    void setUp() throws Exception {
        clock      = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        fileSystem = new FileSystemManager(tempDir.toString());

        InMemoryKeyValueStore store = new InMemoryKeyValueStore(clock);
        tracker = new AttemptTracker(store, objectMapper, clock, 24);
        queue   = new EscalationQueue(store, objectMapper, mock(LearningStore.class), Runnable::run, clock, 24);

        Files.createDirectories(tempDir.resolve("tests"));
        Files.write(tempDir.resolve(TEST_PATH), ORIGINAL.getBytes(StandardCharsets.UTF_8));
    }

    // ================================================================
    // Fixtures
    // ================================================================

    private RegressionSnapshot run(List<String> suite) {
        runnerCalls++;
        RegressionSnapshot next = runs.poll();
        return next != null ? next : RegressionSnapshot.notRun("No scripted run left");
    }

    private ProposalGenerator answering(String rawText) {
        return context -> {
            lastContext = context;
            return new GeneratedProposal(rawText, 0.01, "test-model");
        };
    }

    private static String response(String diagnosis, String confidence, String code) {
        return "DIAGNOSIS: " + diagnosis + "\nCONFIDENCE: " + confidence + "\nFIX:\n```typescript\n" + code + "```\n";
    }

    private FixAttemptController controller(ProposalGenerator generator, EscalationPolicy policy) {
        return controller(generator, policy, tracker, queue);
    }

    private FixAttemptController controller(ProposalGenerator generator, EscalationPolicy policy,
                                            AttemptTracker attemptTracker, EscalationQueue escalationQueue) {
        return new FixAttemptController(
                attemptTracker,
                this::run,
                fileSystem,
                new ContextGatherer(fileSystem),
                generator,
                new ProposalParser(0.5),
                new DiffGenerator(),
                new ArtifactWriter(tempDir.toString(), "artifacts", "logs", objectMapper, clock),
                escalationQueue,
                policy,
                clock,
                3,
                0.7,
                List.of("tests/auth.spec.ts", "tests/core_nav.spec.ts"));
    }

    /** Workspace whose writes and/or restores fail; the rest goes to disk. */
    private FileSystemManager failingFileSystem(boolean failWrite, boolean failRestore) {
        return new FileSystemManager(tempDir.toString()) {
            @Override
            public void writeFile(String relativePath, String content) throws FileSystemException {
                if (failWrite) throw new FileSystemException("Disk full");
                super.writeFile(relativePath, content);
            }

            @Override
            public void restoreFile(FileSnapshot snapshot) throws FileSystemException {
                if (failRestore) throw new FileSystemException("Permission denied");
                super.restoreFile(snapshot);
            }
        };
    }

    private byte[] currentBytes() throws Exception {
        return Files.readAllBytes(tempDir.resolve(TEST_PATH));
    }

    // ================================================================
    // Successful fix
    // ================================================================

    @Test
    void testHighConfidenceFixWithoutRegressionIsKept() throws Exception {
        runs.add(RegressionSnapshot.of(5, 1));
        runs.add(RegressionSnapshot.of(6, 0));

        FixResult result = controller(answering(response("Selector was renamed", "0.9", FIXED)),
                EscalationPolicy.enabled()).attemptFix(TEST_PATH, ERROR, "task-a", null);

        assertEquals(FixOutcome.FIX_APPLIED, result.getOutcome());
        assertTrue(result.isSuccess());
        assertEquals(FIXED, Files.readString(tempDir.resolve(TEST_PATH)));
        assertEquals("Selector was renamed", result.getDiagnosis());
        assertEquals(0.9, result.getConfidence(), 1e-9);
        assertEquals(0, result.getComparison().getNewFailures());
        assertTrue(result.getComparison().isImproved());
        assertEquals(1, result.getAttempts());
        assertEquals(0.01, result.getCostUsd(), 1e-9);
        assertEquals(2, runnerCalls);

        assertNotNull(result.getArtifacts());
        String diff = Files.readString(Path.of(result.getArtifacts().getDiffPath()));
        assertTrue(diff.contains("+  await page.click('[data-testid=\"login-button\"]');"));
        assertTrue(Files.exists(Path.of(result.getArtifacts().getReportPath())));

        assertTrue(queue.list(true, null).isEmpty());
    }

    @Test
    void testContextCarriesTestContentAndError() {
        runs.add(RegressionSnapshot.of(1, 0));
        runs.add(RegressionSnapshot.of(1, 0));

        controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-ctx", null);

        assertEquals(TEST_PATH, lastContext.getTestPath());
        assertEquals(ORIGINAL, lastContext.getTestContent());
        assertEquals(ERROR, lastContext.getErrorMessage());
    }

    @Test
    void testDefaultTaskIdAndFeature() {
        runs.add(RegressionSnapshot.of(1, 0));
        runs.add(RegressionSnapshot.of(1, 0));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, null, null);

        assertEquals("fix_" + clock.instant().getEpochSecond() + "_login.spec", result.getTaskId());
    }

    @Test
    void testUnattendedLowConfidenceIsAppliedBehindRegressionGate() throws Exception {
        runs.add(RegressionSnapshot.of(3, 1));
        runs.add(RegressionSnapshot.of(4, 0));

        FixResult result = controller(answering(response("Guess", "0.4", FIXED)), EscalationPolicy.disabled())
                .attemptFix(TEST_PATH, ERROR, "task-u", null);

        assertEquals(FixOutcome.FIX_APPLIED, result.getOutcome());
        assertEquals(FIXED, Files.readString(tempDir.resolve(TEST_PATH)));
        assertTrue(queue.list(true, null).isEmpty());
    }

    // ================================================================
    // Escalations
    // ================================================================

    @Test
    void testLowConfidenceEscalatesWithoutTouchingTheFile() throws Exception {
        runs.add(RegressionSnapshot.of(5, 1));

        FixResult result = controller(answering(response("Not sure", "0.4", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-b", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertTrue(result.getReason().startsWith("Escalated: Low confidence (0.40 < 0.70)"));
        assertTrue(result.isQueued());
        assertEquals(1, runnerCalls);
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
        assertEquals(0.01, result.getCostUsd(), 1e-9);

        EscalationItem item = queue.get("task-b");
        assertNotNull(item);
        assertEquals(EscalationReason.LOW_CONFIDENCE, item.getEscalationReason());
        assertEquals(Severity.MEDIUM, item.getSeverity());
        assertEquals("Not sure", item.getAiDiagnosis());
        assertEquals(0.4, item.getAiConfidence(), 1e-9);
        assertEquals(TEST_PATH, item.getCodePath());
        assertEquals(ERROR, item.getLastError());
        assertEquals(1, item.getAttemptHistory().size());
        // medium 0.3 + one attempt 0.1 + "login" feature 0.3
        assertEquals(0.7, item.getPriority(), 1e-9);
        assertTrue(item.getArtifacts().get("diff").contains("login-button"));
        assertEquals(FIXED, item.getArtifacts().get("proposed_fix"));
    }

    @Test
    void testRegressionRollsBackByteExactAndEscalates() throws Exception {
        runs.add(RegressionSnapshot.of(5, 0));
        runs.add(RegressionSnapshot.of(4, 1));

        FixResult result = controller(answering(response("Selector was renamed", "0.95", FIXED)),
                EscalationPolicy.enabled()).attemptFix(TEST_PATH, ERROR, "task-c", "checkout flow");

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertEquals(1, result.getComparison().getNewFailures());
        assertTrue(result.getReason().contains("1 new failure(s); original file restored"));
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());

        String report = Files.readString(Path.of(result.getArtifacts().getReportPath()));
        assertFalse(objectMapper.readTree(report).get("fix_applied").asBoolean());

        EscalationItem item = queue.get("task-c");
        assertEquals(EscalationReason.REGRESSION_DETECTED, item.getEscalationReason());
        assertEquals(Severity.HIGH, item.getSeverity());
        assertEquals("checkout flow", item.getFeature());
        assertEquals(result.getArtifacts().getReportPath(), item.getArtifacts().get("report_path"));
        assertEquals("5 passed, 0 failed", item.getArtifacts().get("baseline"));
        assertEquals("4 passed, 1 failed", item.getArtifacts().get("after_fix"));
    }

    @Test
    void testRegressionStillEscalatesInUnattendedMode() throws Exception {
        runs.add(RegressionSnapshot.of(5, 0));
        runs.add(RegressionSnapshot.of(3, 2));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.disabled())
                .attemptFix(TEST_PATH, ERROR, "task-cu", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
        assertNotNull(queue.get("task-cu"));
    }

    @Test
    void testRegressionWithFailedRollbackEscalatesAsCritical() throws Exception {
        fileSystem = failingFileSystem(false, true);
        runs.add(RegressionSnapshot.of(5, 0));
        runs.add(RegressionSnapshot.of(4, 1));

        FixResult result = controller(answering(response("Selector was renamed", "0.9", FIXED)),
                EscalationPolicy.enabled()).attemptFix(TEST_PATH, ERROR, "task-rb", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertTrue(result.getReason().contains("could not be restored"));
        assertTrue(result.isQueued());
        // The fixed content is still on disk
        assertEquals(FIXED, Files.readString(tempDir.resolve(TEST_PATH)));

        EscalationItem item = queue.get("task-rb");
        assertEquals(EscalationReason.ROLLBACK_FAILED, item.getEscalationReason());
        assertEquals(Severity.CRITICAL, item.getSeverity());
        // critical 0.7 + one attempt 0.1 + "login" feature 0.3, capped
        assertEquals(1.0, item.getPriority(), 1e-9);
    }

    @Test
    void testRollbackFailureEscalatesEvenInUnattendedMode() {
        fileSystem = failingFileSystem(false, true);
        runs.add(RegressionSnapshot.of(5, 0));
        runs.add(RegressionSnapshot.of(4, 1));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.disabled())
                .attemptFix(TEST_PATH, ERROR, "task-rbu", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertEquals(EscalationReason.ROLLBACK_FAILED, queue.get("task-rbu").getEscalationReason());
    }

    @Test
    void testPostFixRunFailureWithFailedRollbackEscalates() {
        fileSystem = failingFileSystem(false, true);
        runs.add(RegressionSnapshot.of(5, 1));
        runs.add(RegressionSnapshot.notRun("Playwright crashed"));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-pf", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertEquals("Escalated: Post-fix regression run failed and the original file could not be restored",
                result.getReason());
        EscalationItem item = queue.get("task-pf");
        assertEquals(EscalationReason.ROLLBACK_FAILED, item.getEscalationReason());
        assertEquals(Severity.CRITICAL, item.getSeverity());
    }

    @Test
    void testApplyAndRollbackBothFailingEscalates() {
        fileSystem = failingFileSystem(true, true);
        runs.add(RegressionSnapshot.of(5, 1));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-ap", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertEquals("Escalated: Failed to apply fix and failed to restore the original file", result.getReason());
        assertEquals(1, runnerCalls);
        EscalationItem item = queue.get("task-ap");
        assertEquals(EscalationReason.ROLLBACK_FAILED, item.getEscalationReason());
        assertEquals(Severity.CRITICAL, item.getSeverity());
    }

    @Test
    void testMaxRetriesEscalatesWithoutRunningAnything() {
        FixAttemptController controller = controller(
                answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled());
        for (int i = 0; i < 3; i++) {
            runs.add(RegressionSnapshot.of(5, 0));
            runs.add(RegressionSnapshot.of(4, 1));
            assertEquals(FixOutcome.ESCALATED, controller.attemptFix(TEST_PATH, ERROR, "task-d", null).getOutcome());
        }
        int callsBefore = runnerCalls;

        FixResult result = controller.attemptFix(TEST_PATH, ERROR, "task-d", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertEquals("Escalated: Max retries (3) exceeded", result.getReason());
        assertEquals(4, result.getAttempts());
        assertEquals(callsBefore, runnerCalls);
        assertEquals(0.0, result.getCostUsd());

        EscalationItem item = queue.get("task-d");
        assertEquals(EscalationReason.MAX_RETRIES_EXCEEDED, item.getEscalationReason());
        assertEquals(4, item.getAttempts());
        assertEquals(4, item.getAttemptHistory().size());
    }

    @Test
    void testMaxRetriesInUnattendedModeAbortsWithoutQueueing() {
        for (int i = 0; i < 3; i++) tracker.increment("task-e", TEST_PATH);

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.disabled())
                .attemptFix(TEST_PATH, ERROR, "task-e", null);

        assertEquals(FixOutcome.ABORTED, result.getOutcome());
        assertEquals(FailureKind.MAX_RETRIES_EXCEEDED, result.getFailureKind());
        assertEquals(0, runnerCalls);
        assertNull(queue.get("task-e"));
    }

    @Test
    void testQueueFailureIsReportedNotThrown() {
        runs.add(RegressionSnapshot.of(5, 1));
        EscalationQueue failingQueue = mock(EscalationQueue.class);
        when(failingQueue.add(any())).thenThrow(new StoreUnavailableException("store down"));

        FixResult result = controller(answering(response("d", "0.3", FIXED)), EscalationPolicy.enabled(),
                tracker, failingQueue).attemptFix(TEST_PATH, ERROR, "task-q", null);

        assertEquals(FixOutcome.ESCALATED, result.getOutcome());
        assertFalse(result.isQueued());
        assertNotNull(result.getEscalation());
    }

    // ================================================================
    // Aborts
    // ================================================================

    @Test
    void testBaselineFailureAborts() throws Exception {
        runs.add(RegressionSnapshot.timedOut("partial", 120));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-f", null);

        assertEquals(FixOutcome.ABORTED, result.getOutcome());
        assertEquals(FailureKind.BASELINE_CAPTURE_FAILURE, result.getFailureKind());
        assertTrue(result.getReason().contains("timed out"));
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
    }

    @Test
    void testRunnerExceptionCountsAsBaselineFailure() {
        FixAttemptController controller = new FixAttemptController(
                tracker,
                suite -> { throw new IllegalStateException("npx not found"); },
                fileSystem,
                new ContextGatherer(fileSystem),
                answering(response("d", "0.9", FIXED)),
                new ProposalParser(0.5),
                new DiffGenerator(),
                new ArtifactWriter(tempDir.toString(), "artifacts", "logs", objectMapper, clock),
                queue,
                EscalationPolicy.enabled(),
                clock,
                3,
                0.7,
                List.of("tests/auth.spec.ts"));

        FixResult result = controller.attemptFix(TEST_PATH, ERROR, "task-g", null);

        assertEquals(FailureKind.BASELINE_CAPTURE_FAILURE, result.getFailureKind());
        assertTrue(result.getReason().contains("npx not found"));
    }

    @Test
    void testMissingTestFileAborts() {
        runs.add(RegressionSnapshot.of(1, 0));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix("tests/missing.spec.ts", ERROR, "task-h", null);

        assertEquals(FailureKind.FILE_ACCESS_FAILURE, result.getFailureKind());
        assertTrue(result.getReason().startsWith("Failed to read test file"));
    }

    @Test
    void testGenerationFailureKeepsCost() throws Exception {
        runs.add(RegressionSnapshot.of(1, 0));
        ProposalGenerator failing = context -> {
            throw new ProposalGenerationException("AI fix generation failed: timeout", null, 0.02);
        };

        FixResult result = controller(failing, EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-i", null);

        assertEquals(FailureKind.PROPOSAL_GENERATION_FAILURE, result.getFailureKind());
        assertEquals(0.02, result.getCostUsd(), 1e-9);
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
    }

    @Test
    void testUnparseableProposalAbortsWithCost() throws Exception {
        runs.add(RegressionSnapshot.of(1, 0));

        FixResult result = controller(answering("I think the selector changed."), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-j", null);

        assertEquals(FailureKind.PROPOSAL_PARSE_FAILURE, result.getFailureKind());
        assertEquals("Could not extract fixed code from AI response", result.getReason());
        assertEquals(0.01, result.getCostUsd(), 1e-9);
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
    }

    @Test
    void testApplyFailureRestoresAndAborts() throws Exception {
        fileSystem = failingFileSystem(true, false);
        runs.add(RegressionSnapshot.of(5, 1));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-aw", null);

        assertEquals(FixOutcome.ABORTED, result.getOutcome());
        assertEquals(FailureKind.FILE_ACCESS_FAILURE, result.getFailureKind());
        assertEquals("Failed to apply fix: Disk full", result.getReason());
        assertEquals(0.01, result.getCostUsd(), 1e-9);
        assertEquals(1, runnerCalls);
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
        assertNull(queue.get("task-aw"));
    }

    @Test
    void testPostFixRunFailureRestoresOriginal() throws Exception {
        runs.add(RegressionSnapshot.of(5, 1));
        runs.add(RegressionSnapshot.notRun("Playwright crashed"));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled())
                .attemptFix(TEST_PATH, ERROR, "task-k", null);

        assertEquals(FixOutcome.ABORTED, result.getOutcome());
        assertEquals(FailureKind.POST_FIX_RUN_FAILURE, result.getFailureKind());
        assertTrue(result.getReason().endsWith("original file restored"));
        assertArrayEquals(ORIGINAL.getBytes(StandardCharsets.UTF_8), currentBytes());
    }

    @Test
    void testStoreOutageAbortsBeforeAnyWork() {
        AttemptTracker unavailable = mock(AttemptTracker.class);
        when(unavailable.increment(anyString(), anyString())).thenThrow(new StoreUnavailableException("INCR failed"));

        FixResult result = controller(answering(response("d", "0.9", FIXED)), EscalationPolicy.enabled(),
                unavailable, queue).attemptFix(TEST_PATH, ERROR, "task-l", null);

        assertEquals(FailureKind.STORE_UNAVAILABLE, result.getFailureKind());
        assertEquals(0, runnerCalls);
    }

    @Test
    void testMissingTestPathIsRejected() {
        FixAttemptController controller = controller(answering(""), EscalationPolicy.enabled());

        assertThrows(IllegalArgumentException.class, () -> controller.attemptFix(" ", ERROR, null, null));
    }
}

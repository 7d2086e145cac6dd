package com.fixguard.core.escalation;

import com.fixguard.MutableClock;
import com.fixguard.config.FixGuardConfig;
import com.fixguard.core.learning.LearningStore;
import com.fixguard.core.store.InMemoryKeyValueStore;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

class EscalationQueueTest {

    private MutableClock          clock;
    private InMemoryKeyValueStore store;
    private LearningStore         learningStore;
    private EscalationQueue       queue;

    private final Annotation annotation = new Annotation(
            "selector_change", "update data-testid", Severity.MEDIUM, "Button was renamed", null);

    @BeforeEach
    void setUp() {
        clock         = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        store         = new InMemoryKeyValueStore(clock);
        learningStore = mock(LearningStore.class);
        queue         = newQueue(Runnable::run);
    }

    private EscalationQueue newQueue(Executor executor) {
        return new EscalationQueue(store, FixGuardConfig.createObjectMapper(), learningStore,
                executor, clock, 24);
    }

    private EscalationItem item(String taskId, Double priority, String feature) {
        EscalationItem item = new EscalationItem(taskId);
        item.setFeature(feature);
        item.setCodePath("tests/" + feature + ".spec.ts");
        item.setAttempts(1);
        item.setLastError("element not found");
        item.setEscalationReason(EscalationReason.LOW_CONFIDENCE);
        item.setSeverity(Severity.MEDIUM);
        item.setPriority(priority);
        return item;
    }

    private static List<String> ids(List<EscalationItem> items) {
        return items.stream().map(EscalationItem::getTaskId).collect(Collectors.toList());
    }

    @Test
    void testAddRequiresTaskId() {
        assertThrows(IllegalArgumentException.class, () -> queue.add(new EscalationItem()));
        assertThrows(IllegalArgumentException.class, () -> queue.add(new EscalationItem(" ")));
    }

    @Test
    void testAddFillsCreatedAtAndDefaultPriority() {
        queue.add(item("t1", null, "login"));

        EscalationItem stored = queue.get("t1");
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), stored.getCreatedAt());
        // medium 0.3 + 1 attempt 0.1 + login 0.3
        assertEquals(0.7, stored.getPriority(), 1e-9);
        assertFalse(stored.isResolved());
    }

    @Test
    void testSuppliedPriorityIsKeptButClamped() {
        queue.add(item("t1", 0.42, "profile"));
        queue.add(item("t2", 3.0, "profile"));

        assertEquals(0.42, queue.get("t1").getPriority(), 1e-9);
        assertEquals(1.0, queue.get("t2").getPriority(), 1e-9);
    }

    @Test
    void testListIsOrderedByPriorityAndCapped() {
        queue.add(item("low", 0.2, "a"));
        queue.add(item("high", 0.9, "b"));
        queue.add(item("mid", 0.5, "c"));

        List<EscalationItem> all = queue.list(false, null);
        assertEquals(List.of("high", "mid", "low"), ids(all));

        List<EscalationItem> top = queue.list(false, 2);
        assertEquals(List.of("high", "mid"), ids(top));
    }

    @Test
    void testResolveScenario() {
        queue.add(item("t1", 0.6, "checkout"));
        clock.advance(Duration.ofMinutes(30));

        assertTrue(queue.resolve("t1", annotation));

        EscalationItem resolved = queue.get("t1");
        assertTrue(resolved.isResolved());
        assertEquals(Instant.parse("2024-05-01T10:30:00Z"), resolved.getResolvedAt());
        assertEquals("selector_change", resolved.getAnnotation().getRootCauseCategory());
        assertTrue(queue.list(false, null).isEmpty());

        verify(learningStore, times(1)).storeAnnotation(
                startsWith("annotation_t1_"), eq("checkout"), any(Annotation.class));
    }

    @Test
    void testResolvedItemsListedOnlyOnRequest() {
        queue.add(item("open", 0.3, "a"));
        queue.add(item("done", 0.8, "b"));
        queue.resolve("done", annotation);

        assertEquals(List.of("open"), ids(queue.list(false, null)));
        assertEquals(List.of("done", "open"), ids(queue.list(true, null)));
    }

    @Test
    void testAddingAResolvedItemKeepsItOutOfTheActiveList() {
        EscalationItem done = item("done", 0.9, "login");
        done.setResolved(true);
        queue.add(done);
        queue.add(item("open", 0.2, "x"));

        assertEquals(List.of("open"), ids(queue.list(false, null)));
        assertEquals(List.of("done", "open"), ids(queue.list(true, null)));

        QueueStats stats = queue.stats();
        assertEquals(1, stats.getActiveCount());
        assertEquals(1, stats.getResolvedCount());
        assertEquals(2, stats.getTotalCount());
    }

    @Test
    void testStaleActiveEntryOfResolvedItemIsNotListed() {
        queue.add(item("t1", 0.5, "login"));
        queue.resolve("t1", annotation);
        // a concurrent add re-indexed the task after it was resolved
        store.sortedSetAdd(EscalationQueue.ACTIVE_INDEX, "t1", 0.5);

        assertTrue(queue.list(false, null).isEmpty());
        assertEquals(List.of("t1"), ids(queue.list(true, null)));

        QueueStats stats = queue.stats();
        assertEquals(0, stats.getActiveCount());
        assertEquals(1, stats.getResolvedCount());
        assertEquals(1, stats.getTotalCount());
    }

    @Test
    void testSecondResolveIsRejectedAndForwardsOnce() {
        queue.add(item("t1", 0.5, "login"));

        assertTrue(queue.resolve("t1", annotation));
        assertFalse(queue.resolve("t1", annotation));

        verify(learningStore, times(1)).storeAnnotation(anyString(), anyString(), any(Annotation.class));
    }

    @Test
    void testResolveUnknownTask() {
        assertFalse(queue.resolve("missing", annotation));
        verifyNoInteractions(learningStore);
    }

    @Test
    void testLearningStoreFailureDoesNotUndoResolve() {
        when(learningStore.storeAnnotation(anyString(), anyString(), any(Annotation.class)))
                .thenThrow(new IllegalStateException("vector store down"));
        queue.add(item("t1", 0.5, "login"));

        assertTrue(queue.resolve("t1", annotation));
        assertTrue(queue.get("t1").isResolved());
    }

    @Test
    void testRejectedLearningWriteDoesNotUndoResolve() {
        EscalationQueue saturated = newQueue(task -> { throw new RejectedExecutionException("full"); });
        saturated.add(item("t1", 0.5, "login"));

        assertTrue(saturated.resolve("t1", annotation));
        assertTrue(saturated.get("t1").isResolved());
    }

    @Test
    void testStats() {
        queue.add(item("a", 0.9, "x"));
        queue.add(item("b", 0.5, "x"));
        queue.add(item("c", 0.8, "x"));
        queue.resolve("c", annotation);

        QueueStats stats = queue.stats();

        assertEquals(3, stats.getTotalCount());
        assertEquals(2, stats.getActiveCount());
        assertEquals(1, stats.getResolvedCount());
        assertEquals(0.7, stats.getAvgPriority(), 1e-9);
        assertEquals(1, stats.getHighPriorityCount());
    }

    @Test
    void testExpiredRecordsDropOutOfTheIndex() {
        queue.add(item("t1", 0.5, "x"));
        clock.advance(Duration.ofHours(25));

        assertNull(queue.get("t1"));
        assertTrue(queue.list(true, null).isEmpty());
        assertEquals(0, queue.stats().getTotalCount());
    }

    @Test
    void testItemRoundTripKeepsPayload() {
        EscalationItem original = item("t1", 0.5, "login");
        original.setAiDiagnosis("selector renamed");
        original.setAiConfidence(0.35);
        original.setScreenshots(List.of("artifacts/login.spec-1.png"));
        original.getArtifacts().put("diff", "--- a/x\n+++ b/x\n");
        queue.add(original);

        EscalationItem stored = queue.get("t1");

        assertEquals(EscalationReason.LOW_CONFIDENCE, stored.getEscalationReason());
        assertEquals(Severity.MEDIUM, stored.getSeverity());
        assertEquals("selector renamed", stored.getAiDiagnosis());
        assertEquals(0.35, stored.getAiConfidence(), 1e-9);
        assertEquals(List.of("artifacts/login.spec-1.png"), stored.getScreenshots());
        assertEquals("--- a/x\n+++ b/x\n", stored.getArtifacts().get("diff"));
    }
}

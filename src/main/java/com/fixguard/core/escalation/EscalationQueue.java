package com.fixguard.core.escalation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixguard.core.learning.LearningStore;
import com.fixguard.core.store.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;

/**
 * Durable, priority-ordered queue of tasks waiting for human review.
 *
 * Key layout:
 *   escalation:item:{taskId}  : item JSON, TTL
 *   escalation:queue          : sorted set of active task ids, score = priority
 *   escalation:resolved       : sorted set of resolved task ids, score = priority
 *
 * Resolved items leave the active index but stay readable until their record expires.
 * Index entries whose record has expired are pruned on read.
 */
@Component
public class EscalationQueue {

    private static final Logger log = LoggerFactory.getLogger(EscalationQueue.class);

    static final String ACTIVE_INDEX    = "escalation:queue";
    static final String RESOLVED_INDEX  = "escalation:resolved";
    static final String ITEM_KEY_PREFIX = "escalation:item:";

    static final double HIGH_PRIORITY_THRESHOLD = 0.7;

    private final KeyValueStore store;
    private final ObjectMapper  objectMapper;
    private final LearningStore learningStore;
    private final Executor      learningExecutor;
    private final Clock         clock;
    private final Duration      ttl;

    public EscalationQueue(
            KeyValueStore store,
            ObjectMapper  objectMapper,
            LearningStore learningStore,
            @Qualifier("learningStoreExecutor") Executor learningExecutor,
            Clock         clock,
            @Value("${fixguard.escalation.ttl-hours:24}") long ttlHours
    ) {
        this.store            = store;
        this.objectMapper     = objectMapper;
        this.learningStore    = learningStore;
        this.learningExecutor = learningExecutor;
        this.clock            = clock;
        this.ttl              = Duration.ofHours(ttlHours);
    }

    // ================================================================
    // Write path
    // ================================================================

    public boolean add(EscalationItem item) {
        if (item == null || item.getTaskId() == null || item.getTaskId().isBlank()) {
            throw new IllegalArgumentException("task_id is required");
        }

        Instant now = clock.instant();
        if (item.getCreatedAt() == null) item.setCreatedAt(now);

        if (item.getPriority() == null) {
            item.setPriority(EscalationPriority.computePriority(
                    item.getSeverity(), item.getAttempts(), item.getFeature(), item.getCreatedAt(), now));
        } else {
            item.setPriority(EscalationPriority.clamp(item.getPriority()));
        }

        save(item);
        if (item.isResolved()) {
            store.sortedSetRemove(ACTIVE_INDEX, item.getTaskId());
            store.sortedSetAdd(RESOLVED_INDEX, item.getTaskId(), item.getPriority());
        } else {
            store.sortedSetRemove(RESOLVED_INDEX, item.getTaskId());
            store.sortedSetAdd(ACTIVE_INDEX, item.getTaskId(), item.getPriority());
        }

        log.info("[EscalationQueue] Queued {} reason={} priority={}",
                item.getTaskId(), item.getEscalationReason(), String.format("%.2f", item.getPriority()));
        return true;
    }

    /**
     * Marks the item resolved and forwards the annotation to the learning store.
     *
     * @return false when the task is unknown or already resolved; the annotation is
     *         forwarded only by the call that moves the item out of the active index
     */
    public boolean resolve(String taskId, Annotation annotation) {
        if (annotation == null) throw new IllegalArgumentException("annotation is required");

        EscalationItem item = get(taskId);
        if (item == null) {
            log.warn("[EscalationQueue] Resolve for unknown task {}", taskId);
            return false;
        }
        if (item.isResolved() || !store.sortedSetRemove(ACTIVE_INDEX, taskId)) {
            log.warn("[EscalationQueue] Task {} is already resolved", taskId);
            return false;
        }

        Instant now = clock.instant();
        item.setAnnotation(annotation);
        item.setResolved(true);
        item.setResolvedAt(now);

        save(item);
        store.sortedSetAdd(RESOLVED_INDEX, taskId, item.getPriority() != null ? item.getPriority() : 0.0);

        forwardToLearningStore("annotation_" + taskId + "_" + now.toEpochMilli(), item, annotation);

        log.info("[EscalationQueue] Resolved {} with {}", taskId, annotation);
        return true;
    }

    // ================================================================
    // Read path
    // ================================================================

    public EscalationItem get(String taskId) {
        if (taskId == null || taskId.isBlank()) return null;
        String json = store.get(ITEM_KEY_PREFIX + taskId);
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, EscalationItem.class);
        } catch (JsonProcessingException e) {
            log.error("[EscalationQueue] Unreadable record for {}: {}", taskId, e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Items in descending priority order. The record's resolved flag decides whether an
     * item is active, whichever index it was found in.
     *
     * @param limit maximum number of items, null or non-positive for all
     */
    public List<EscalationItem> list(boolean includeResolved, Integer limit) {
        List<EscalationItem> items = new ArrayList<>();
        for (EscalationItem item : loadAll()) {
            if (includeResolved || !item.isResolved()) items.add(item);
        }
        items.sort((a, b) -> Double.compare(priorityOf(b), priorityOf(a)));
        if (limit != null && limit > 0 && items.size() > limit) {
            return new ArrayList<>(items.subList(0, limit));
        }
        return items;
    }

    public QueueStats stats() {
        List<EscalationItem> active   = new ArrayList<>();
        List<EscalationItem> resolved = new ArrayList<>();
        for (EscalationItem item : loadAll()) {
            if (item.isResolved()) resolved.add(item);
            else                   active.add(item);
        }

        double avg = active.stream().mapToDouble(EscalationQueue::priorityOf).average().orElse(0.0);
        int    high = (int) active.stream().filter(i -> priorityOf(i) > HIGH_PRIORITY_THRESHOLD).count();

        return new QueueStats(active.size() + resolved.size(), active.size(), resolved.size(), avg, high);
    }

    public boolean ping() {
        return store.ping();
    }

    // ================================================================
    // Private helpers
    // ================================================================

    /** Both indexes, one entry per task id; a task can sit in both while add and resolve race. */
    private List<EscalationItem> loadAll() {
        Map<String, EscalationItem> byId = new LinkedHashMap<>();
        for (EscalationItem item : load(ACTIVE_INDEX))   byId.put(item.getTaskId(), item);
        for (EscalationItem item : load(RESOLVED_INDEX)) byId.putIfAbsent(item.getTaskId(), item);
        return new ArrayList<>(byId.values());
    }

    private List<EscalationItem> load(String index) {
        List<EscalationItem> items = new ArrayList<>();
        for (String taskId : store.sortedSetRangeDescending(index, 0, -1)) {
            EscalationItem item = get(taskId);
            if (item == null) {
                log.debug("[EscalationQueue] Pruning expired entry {} from {}", taskId, index);
                store.sortedSetRemove(index, taskId);
                continue;
            }
            items.add(item);
        }
        return items;
    }

    private void save(EscalationItem item) {
        try {
            store.set(ITEM_KEY_PREFIX + item.getTaskId(), objectMapper.writeValueAsString(item), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize escalation item " + item.getTaskId(), e);
        }
    }

    private void forwardToLearningStore(String annotationId, EscalationItem item, Annotation annotation) {
        String description = item.getFeature() != null ? item.getFeature() : "";
        Runnable task = () -> {
            try {
                learningStore.storeAnnotation(annotationId, description, annotation);
            } catch (RuntimeException e) {
                log.warn("[EscalationQueue] Learning store write {} failed: {}", annotationId, e.getMessage());
            }
        };
        try {
            learningExecutor.execute(task);
        } catch (RuntimeException e) {
            log.warn("[EscalationQueue] Learning store write {} rejected: {}", annotationId, e.getMessage());
        }
    }

    private static double priorityOf(EscalationItem item) {
        return item.getPriority() != null ? item.getPriority() : 0.0;
    }
}

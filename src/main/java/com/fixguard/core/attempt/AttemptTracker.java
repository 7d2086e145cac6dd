package com.fixguard.core.attempt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixguard.core.store.KeyValueStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable per-task attempt counters and attempt history.
 *
 * Key layout:
 *   fix:attempts:{taskId}  : integer counter, TTL set when the counter is created
 *   fix:history:{taskId}   : list of AttemptRecord JSON, TTL refreshed on each append
 *
 * The counter is the source of truth; the history list is informational and never
 * consulted for control flow. Store outages propagate as StoreUnavailableException.
 */
@Component
public class AttemptTracker {

    private static final Logger log = LoggerFactory.getLogger(AttemptTracker.class);

    static final String ATTEMPTS_KEY_PREFIX = "fix:attempts:";
    static final String HISTORY_KEY_PREFIX  = "fix:history:";

    private final KeyValueStore store;
    private final ObjectMapper  objectMapper;
    private final Clock         clock;
    private final Duration      ttl;

    public AttemptTracker(
            KeyValueStore store,
            ObjectMapper  objectMapper,
            Clock         clock,
            @Value("${fixguard.attempts.ttl-hours:24}") long ttlHours
    ) {
        this.store        = store;
        this.objectMapper = objectMapper;
        this.clock        = clock;
        this.ttl          = Duration.ofHours(ttlHours);
    }

    /**
     * Records one more attempt for the task.
     *
     * @return the attempt number, 1 for the first attempt inside the TTL window
     */
    public int increment(String taskId, String testPath) {
        long attempts = store.increment(ATTEMPTS_KEY_PREFIX + taskId, ttl);

        AttemptRecord record = new AttemptRecord((int) attempts, clock.instant(), testPath);
        store.listAppend(HISTORY_KEY_PREFIX + taskId, toJson(record), ttl);

        log.info("[AttemptTracker] task={} attempt={}", taskId, attempts);
        return (int) attempts;
    }

    /** @return the current attempt count, 0 when the task is unknown or expired. */
    public int get(String taskId) {
        String current = store.get(ATTEMPTS_KEY_PREFIX + taskId);
        if (current == null) return 0;
        try {
            return Integer.parseInt(current.trim());
        } catch (NumberFormatException e) {
            log.warn("[AttemptTracker] Non-numeric counter for task {}: '{}'", taskId, current);
            return 0;
        }
    }

    /** @return the attempt records in insertion order. */
    public List<AttemptRecord> history(String taskId) {
        List<AttemptRecord> records = new ArrayList<>();
        for (String json : store.listRange(HISTORY_KEY_PREFIX + taskId)) {
            try {
                records.add(objectMapper.readValue(json, AttemptRecord.class));
            } catch (JsonProcessingException e) {
                log.warn("[AttemptTracker] Skipping unreadable history entry for {}: {}",
                        taskId, e.getOriginalMessage());
            }
        }
        return records;
    }

    private String toJson(AttemptRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize attempt record", e);
        }
    }
}

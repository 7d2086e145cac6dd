package com.fixguard.core.store;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-process {@link KeyValueStore} for the {@code in-memory} profile and for tests.
 *
 * All operations are synchronized on the instance, which gives the same atomicity
 * the Redis commands give. Expiry is evaluated lazily against the injected clock.
 * Sorted-set reads follow ZREVRANGE ordering: score descending, then member descending.
 */
@Component
@Profile("in-memory")
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Clock clock;

    private final Map<String, String>              strings    = new HashMap<>();
    private final Map<String, List<String>>        lists      = new HashMap<>();
    private final Map<String, Map<String, Double>> sortedSets = new HashMap<>();
    private final Map<String, Instant>             expiries   = new HashMap<>();

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized String get(String key) {
        evictIfExpired(key);
        return strings.get(key);
    }

    @Override
    public synchronized void set(String key, String value, Duration ttl) {
        strings.put(key, value);
        applyTtl(key, ttl);
    }

    @Override
    public synchronized long increment(String key, Duration ttlOnCreate) {
        evictIfExpired(key);
        String current = strings.get(key);
        long next;
        try {
            next = current == null ? 1L : Long.parseLong(current) + 1L;
        } catch (NumberFormatException e) {
            throw new StoreUnavailableException("Value at " + key + " is not an integer", e);
        }
        strings.put(key, Long.toString(next));
        if (next == 1L) applyTtl(key, ttlOnCreate);
        return next;
    }

    @Override
    public synchronized void listAppend(String key, String value, Duration ttl) {
        evictIfExpired(key);
        lists.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        if (ttl != null) applyTtl(key, ttl);
    }

    @Override
    public synchronized List<String> listRange(String key) {
        evictIfExpired(key);
        List<String> values = lists.get(key);
        return values != null ? new ArrayList<>(values) : List.of();
    }

    @Override
    public synchronized void sortedSetAdd(String key, String member, double score) {
        evictIfExpired(key);
        sortedSets.computeIfAbsent(key, k -> new HashMap<>()).put(member, score);
    }

    @Override
    public synchronized List<String> sortedSetRangeDescending(String key, long start, long end) {
        evictIfExpired(key);
        Map<String, Double> members = sortedSets.get(key);
        if (members == null || members.isEmpty()) return List.of();

        Comparator<Map.Entry<String, Double>> ascending =
                Comparator.comparingDouble((Map.Entry<String, Double> e) -> e.getValue())
                          .thenComparing(e -> e.getKey());

        List<String> ordered = members.entrySet().stream()
                .sorted(ascending.reversed())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        int size = ordered.size();
        int from = (int) Math.max(0, start);
        int to   = end < 0 ? size - 1 : (int) Math.min(end, size - 1);
        if (from > to) return List.of();
        return new ArrayList<>(ordered.subList(from, to + 1));
    }

    @Override
    public synchronized boolean sortedSetRemove(String key, String member) {
        evictIfExpired(key);
        Map<String, Double> members = sortedSets.get(key);
        return members != null && members.remove(member) != null;
    }

    @Override
    public boolean ping() {
        return true;
    }

    private void applyTtl(String key, Duration ttl) {
        if (ttl == null) {
            expiries.remove(key);
        } else {
            expiries.put(key, clock.instant().plus(ttl));
        }
    }

    private void evictIfExpired(String key) {
        Instant expiresAt = expiries.get(key);
        if (expiresAt != null && !clock.instant().isBefore(expiresAt)) {
            strings.remove(key);
            lists.remove(key);
            sortedSets.remove(key);
            expiries.remove(key);
        }
    }
}

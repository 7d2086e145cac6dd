package com.fixguard.core.store;

import java.time.Duration;
import java.util.List;

/**
 * The durable state primitive shared by the attempt tracker,
 * the escalation queue and the learning store.
 *
 * Three shapes of data live here:
 *   strings      : get / set / increment
 *   lists        : append-only history with a TTL
 *   sorted sets  : priority index, highest score first on read
 *
 * A null TTL means "no expiry". Implementations must make increment and the
 * sorted-set mutations atomic so concurrent callers on different task ids never
 * lose updates. Backend outages surface as {@link StoreUnavailableException}.
 */
public interface KeyValueStore {

    /** @return the value, or null when the key is absent or expired. */
    String get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Atomically increments the counter at {@code key}, creating it at 1.
     * The TTL is applied only when this call created the key.
     */
    long increment(String key, Duration ttlOnCreate);

    /** Appends to the tail of a list and (re)sets the list's TTL. */
    void listAppend(String key, String value, Duration ttl);

    /** Full list contents in insertion order; empty when absent. */
    List<String> listRange(String key);

    void sortedSetAdd(String key, String member, double score);

    /**
     * Members ordered by descending score, inclusive indices, {@code end == -1}
     * meaning "to the last member".
     */
    List<String> sortedSetRangeDescending(String key, long start, long end);

    boolean sortedSetRemove(String key, String member);

    boolean ping();
}

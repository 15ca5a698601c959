package de.htwsaar.extractcache.cache.store;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hit/Miss/Eviction-Zähler einer Cache-Instanz.
 *
 * <p>Die Werte liegen nur im Speicher der laufenden Instanz und überleben keinen Neustart.</p>
 */
final class CacheCounters {

    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordEvictions(long count) {
        if (count > 0) {
            evictions.addAndGet(count);
        }
    }

    long hits() {
        return hits.get();
    }

    long misses() {
        return misses.get();
    }

    CacheStats snapshot(String backend, long size, long maxSize, String location) {
        long h = hits.get();
        long m = misses.get();
        long totalCacheDecisions = h + m;
        double hitRate = totalCacheDecisions == 0 ? 0.0 : (double) h / totalCacheDecisions;
        return new CacheStats(backend, Math.max(0, size), Math.max(0, maxSize), h, m, evictions.get(), hitRate, location);
    }
}

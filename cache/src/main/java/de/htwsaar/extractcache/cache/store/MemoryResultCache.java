package de.htwsaar.extractcache.cache.store;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Begrenzter In-Memory-Cache via {@link LinkedHashMap} mit {@code accessOrder=true}.
 *
 * <p>Eviction entfernt den am längsten nicht genutzten Eintrag; bei gleichem Zugriff entscheidet die
 * Einfügereihenfolge. Werte werden beim Schreiben und Lesen kopiert, damit Aufrufer gespeicherte
 * Bäume nicht verändern können.</p>
 * <p>Thread-Safety: einfaches {@code synchronized} über alle Operationen.</p>
 */
public final class MemoryResultCache implements ResultCache {

    private static final Logger log = LoggerFactory.getLogger(MemoryResultCache.class);

    /** Standard-Kapazität, wenn nichts konfiguriert ist. */
    public static final int DEFAULT_MAX_SIZE = 1000;

    private final Map<Fingerprint, CacheEntry> map = new LinkedHashMap<>(16, 0.75f, true);
    private final CacheCounters counters = new CacheCounters();
    private final int maxSize;
    private final Duration defaultTtl;
    private final Clock clock;

    /**
     * @param maxSize    maximale Anzahl Einträge (mindestens 1)
     * @param defaultTtl Standard-TTL, {@code null} = läuft nie ab
     * @param clock      Zeitquelle
     */
    public MemoryResultCache(int maxSize, Duration defaultTtl, Clock clock) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 but was " + maxSize);
        }
        this.maxSize = maxSize;
        this.defaultTtl = Ttls.requireValid(defaultTtl);
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Erstellt den Cache mit der System-Uhr.
     */
    public MemoryResultCache(int maxSize, Duration defaultTtl) {
        this(maxSize, defaultTtl, Clock.systemUTC());
    }

    public MemoryResultCache() {
        this(DEFAULT_MAX_SIZE, null);
    }

    @Override
    public synchronized JsonNode get(Fingerprint key) {
        if (key == null) return null;
        CacheEntry e = map.get(key);
        if (e == null) {
            counters.recordMiss();
            return null;
        }
        if (e.isExpired(clock.instant())) {
            map.remove(key);
            counters.recordMiss();
            return null;
        }
        counters.recordHit();
        return e.value().deepCopy();
    }

    @Override
    public void set(Fingerprint key, JsonNode value) {
        set(key, value, defaultTtl);
    }

    @Override
    public synchronized void set(Fingerprint key, JsonNode value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Instant now = clock.instant();
        // put() bei accessOrder=true zählt als Zugriff -> Eintrag wird MRU
        map.put(key, new CacheEntry(value.deepCopy(), now, Ttls.requireValid(ttl)));
        evictIfNeeded();
    }

    @Override
    public synchronized boolean delete(Fingerprint key) {
        if (key == null) return false;
        return map.remove(key) != null;
    }

    @Override
    public synchronized int clear() {
        int removed = map.size();
        map.clear();
        return removed;
    }

    @Override
    public synchronized int cleanupExpired() {
        Instant now = clock.instant();
        int before = map.size();
        // Iteration über entrySet verändert die Zugriffsreihenfolge nicht
        map.entrySet().removeIf(e -> e.getValue().isExpired(now));
        int removed = before - map.size();
        if (removed > 0) {
            log.debug("Removed {} expired entries from memory cache", removed);
        }
        return removed;
    }

    @Override
    public synchronized CacheStats stats() {
        return counters.snapshot("memory", map.size(), maxSize, null);
    }

    private void evictIfNeeded() {
        // LRU-Eviction: ältester Zugriff fliegt zuerst raus
        int evicted = 0;
        while (map.size() > maxSize) {
            Iterator<Fingerprint> it = map.keySet().iterator();
            if (!it.hasNext()) break;
            Fingerprint victim = it.next();
            it.remove();
            evicted++;
            log.debug("Evicted least recently used entry {}", victim);
        }
        counters.recordEvictions(evicted);
    }
}

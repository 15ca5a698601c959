package de.htwsaar.extractcache.cache.config;

import de.htwsaar.extractcache.cache.store.MemoryResultCache;
import de.htwsaar.extractcache.cache.store.Ttls;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Konfiguration eines Cache-Backends.
 *
 * @param backend    gewähltes Backend
 * @param maxSize    maximale Einträge (Memory und SQLite; vom File-Backend ignoriert)
 * @param defaultTtl Standard-TTL, {@code null} = läuft nie ab
 * @param location   Verzeichnis (File) bzw. Datenbankdatei (SQLite); {@code null} = Standardpfad
 */
public record ResultCacheSettings(CacheBackend backend, int maxSize, Duration defaultTtl, Path location) {

    /** Standard-Basisverzeichnis für persistente Backends. */
    public static final Path DEFAULT_BASE_DIR = Path.of(".extractcache");

    public ResultCacheSettings {
        Objects.requireNonNull(backend, "backend must not be null");
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 but was " + maxSize);
        }
        Ttls.requireValid(defaultTtl);
    }

    /**
     * Standardwerte für ein Backend.
     *
     * @param backend Backend
     * @return Settings mit {@code maxSize=1000}, ohne TTL, Standardpfad
     */
    public static ResultCacheSettings defaults(CacheBackend backend) {
        return new ResultCacheSettings(backend, MemoryResultCache.DEFAULT_MAX_SIZE, null, null);
    }

    /**
     * Effektiver Speicherort; ohne explizite Angabe {@code .extractcache/entries} bzw.
     * {@code .extractcache/cache.db}.
     *
     * @return Pfad oder {@code null} für das Memory-Backend
     */
    public Path resolvedLocation() {
        if (backend == CacheBackend.MEMORY) return null;
        if (location != null) return location;
        return backend == CacheBackend.FILE
                ? DEFAULT_BASE_DIR.resolve("entries")
                : DEFAULT_BASE_DIR.resolve("cache.db");
    }
}

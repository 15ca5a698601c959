package de.htwsaar.extractcache.cache.config;

import de.htwsaar.extractcache.cache.store.FileResultCache;
import de.htwsaar.extractcache.cache.store.MemoryResultCache;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.cache.store.SqliteResultCache;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Erzeugt das konfigurierte Backend. Feste Zuordnung Backend -> Konstruktor, keine dynamische Registrierung.
 */
public final class ResultCacheFactory {

    private static final Logger log = LoggerFactory.getLogger(ResultCacheFactory.class);

    private ResultCacheFactory() {}

    /**
     * @param settings Konfiguration
     * @param clock    Zeitquelle
     * @return neues Backend
     * @throws de.htwsaar.extractcache.cache.store.CacheStorageException wenn ein persistentes Backend
     *     nicht geöffnet werden kann
     */
    public static ResultCache create(ResultCacheSettings settings, Clock clock) {
        Objects.requireNonNull(settings, "settings must not be null");
        Objects.requireNonNull(clock, "clock must not be null");

        ResultCache cache = switch (settings.backend()) {
            case MEMORY -> new MemoryResultCache(settings.maxSize(), settings.defaultTtl(), clock);
            case FILE -> new FileResultCache(settings.resolvedLocation(), settings.defaultTtl(), clock);
            case SQLITE -> new SqliteResultCache(
                    settings.resolvedLocation(), settings.maxSize(), settings.defaultTtl(), clock);
        };
        log.info(
                "Result cache ready: backend={}, maxSize={}, defaultTtl={}, location={}",
                settings.backend().configName(),
                settings.maxSize(),
                settings.defaultTtl(),
                settings.resolvedLocation());
        return cache;
    }

    public static ResultCache create(ResultCacheSettings settings) {
        return create(settings, Clock.systemUTC());
    }
}

package de.htwsaar.extractcache.cache.config;

import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.cache.store.Ttls;
import java.nio.file.Path;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung des Ergebnis-Caches.
 *
 * <p>Properties (alle optional):</p>
 * <ul>
 *   <li>{@code extract.cache.backend} – {@code memory} | {@code file} | {@code sqlite} (Standard: memory)</li>
 *   <li>{@code extract.cache.max-size} – maximale Einträge (Standard: 1000)</li>
 *   <li>{@code extract.cache.ttl-seconds} – Standard-TTL, 0 = unbegrenzt (Standard: 0)</li>
 *   <li>{@code extract.cache.location} – Verzeichnis bzw. Datenbankdatei (Standard: unter {@code .extractcache/})</li>
 * </ul>
 */
@Configuration
public class ResultCacheBeans {

    /**
     * Systemuhr für den Cache-Kontext.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock cacheClock() {
        return Clock.systemUTC();
    }

    /**
     * Baut die Cache-Konfiguration aus den Properties.
     *
     * @param backend    Backend-Name
     * @param maxSize    maximale Einträge
     * @param ttlSeconds Standard-TTL in Sekunden (0 = unbegrenzt)
     * @param location   Speicherort oder leer
     * @return Settings
     */
    @Bean
    public ResultCacheSettings resultCacheSettings(
            @Value("${extract.cache.backend:memory}") String backend,
            @Value("${extract.cache.max-size:1000}") int maxSize,
            @Value("${extract.cache.ttl-seconds:0}") double ttlSeconds,
            @Value("${extract.cache.location:}") String location) {

        return new ResultCacheSettings(
                CacheBackend.fromConfig(backend),
                maxSize,
                Ttls.fromConfigSeconds(ttlSeconds),
                location == null || location.isBlank() ? null : Path.of(location.trim()));
    }

    /**
     * Das konfigurierte Backend. Schlägt beim Start fehl, wenn ein persistentes Backend nicht nutzbar ist.
     *
     * @param settings Settings
     * @param cacheClock Zeitquelle
     * @return Backend
     */
    @Bean
    public ResultCache resultCache(ResultCacheSettings settings, Clock cacheClock) {
        return ResultCacheFactory.create(settings, cacheClock);
    }
}

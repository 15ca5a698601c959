package de.htwsaar.extractcache.cli.command.cache;

import de.htwsaar.extractcache.cache.config.CacheBackend;
import de.htwsaar.extractcache.cache.config.ResultCacheFactory;
import de.htwsaar.extractcache.cache.config.ResultCacheSettings;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.cache.store.Ttls;
import java.nio.file.Path;
import java.time.Clock;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Gemeinsame Backend-Optionen der Cache-Subcommands (Picocli-Mixin).
 */
public final class CacheOptions {

    @Spec(Spec.Target.MIXEE)
    private CommandSpec mixee;

    @Option(
            names = {"-b", "--backend"},
            defaultValue = "sqlite",
            paramLabel = "file|sqlite",
            description = "Cache-Backend (Standard: ${DEFAULT-VALUE})")
    private String backend;

    @Option(
            names = {"-l", "--location"},
            paramLabel = "PATH",
            description = "Verzeichnis (file) bzw. Datenbankdatei (sqlite); Standard unter .extractcache/")
    private Path location;

    @Option(
            names = "--max-size",
            defaultValue = "1000",
            paramLabel = "N",
            description = "Maximale Einträge (nur sqlite, Standard: ${DEFAULT-VALUE})")
    private int maxSize;

    @Option(
            names = "--ttl-seconds",
            defaultValue = "0",
            paramLabel = "SECONDS",
            description = "Standard-TTL für neue Einträge, 0 = unbegrenzt")
    private double ttlSeconds;

    /**
     * Baut die Settings aus den Optionen. Das Memory-Backend ist hier nicht sinnvoll,
     * weil es mit dem Prozess endet.
     *
     * @return Settings
     * @throws ParameterException bei ungültigen Werten (Exit-Code 2)
     */
    ResultCacheSettings settings() {
        try {
            CacheBackend b = CacheBackend.fromConfig(backend);
            if (b == CacheBackend.MEMORY) {
                throw new IllegalArgumentException("backend 'memory' does not persist, use file or sqlite");
            }
            return new ResultCacheSettings(b, maxSize, Ttls.fromConfigSeconds(ttlSeconds), location);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(mixee.commandLine(), e.getMessage(), e);
        }
    }

    /**
     * Öffnet das konfigurierte Backend.
     *
     * @param clock Zeitquelle
     * @return Backend
     * @throws de.htwsaar.extractcache.cache.store.CacheStorageException wenn der Speicher nicht nutzbar ist
     */
    ResultCache open(Clock clock) {
        return ResultCacheFactory.create(settings(), clock);
    }
}

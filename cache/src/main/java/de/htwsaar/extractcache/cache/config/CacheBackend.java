package de.htwsaar.extractcache.cache.config;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Unterstützte Speicher-Backends für den Ergebnis-Cache.
 */
public enum CacheBackend {
    MEMORY,
    FILE,
    SQLITE;

    /**
     * Liest einen Backend-Namen aus der Konfiguration (Groß-/Kleinschreibung egal).
     *
     * @param value z. B. {@code "memory"}, {@code "file"}, {@code "sqlite"}
     * @return Backend
     * @throws IllegalArgumentException bei unbekanntem Namen
     */
    public static CacheBackend fromConfig(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("cache backend must not be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (CacheBackend b : values()) {
            if (b.name().equals(normalized)) {
                return b;
            }
        }
        throw new IllegalArgumentException("Unknown cache backend '" + value + "', expected one of "
                + Arrays.stream(values()).map(CacheBackend::configName).collect(Collectors.joining(", ")));
    }

    /**
     * @return Name in Konfigurationsschreibweise (lower case)
     */
    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}

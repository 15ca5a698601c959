package de.htwsaar.extractcache.cache.store;

/**
 * Unveränderlicher Snapshot der Cache-Metriken.
 *
 * @param backend   Backend-Name ({@code memory}, {@code file}, {@code sqlite})
 * @param size      aktuelle Anzahl Einträge
 * @param maxSize   maximale Einträge (0 = unbegrenzt)
 * @param hits      Anzahl Cache-Hits seit Erzeugung der Instanz
 * @param misses    Anzahl Cache-Misses seit Erzeugung der Instanz
 * @param evictions Anzahl verdrängter Einträge (Kapazität, nicht TTL)
 * @param hitRate   Trefferquote zwischen 0 und 1
 * @param location  Verzeichnis bzw. Datenbankdatei, {@code null} für In-Memory
 */
public record CacheStats(
        String backend,
        long size,
        long maxSize,
        long hits,
        long misses,
        long evictions,
        double hitRate,
        String location) {}

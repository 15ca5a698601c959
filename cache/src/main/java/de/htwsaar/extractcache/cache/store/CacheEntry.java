package de.htwsaar.extractcache.cache.store;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Interner, unveränderlicher Cache-Eintrag.
 *
 * @param value     gespeicherter Ergebniswert
 * @param createdAt Einfügezeitpunkt
 * @param ttl       Lebensdauer; {@code null} = läuft nie ab
 */
public record CacheEntry(JsonNode value, Instant createdAt, Duration ttl) {

    public CacheEntry {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Ttls.requireValid(ttl);
    }

    /**
     * Prüft, ob der Eintrag zum Zeitpunkt {@code now} abgelaufen ist ({@code now - createdAt > ttl}).
     *
     * @param now aktueller Zeitpunkt
     * @return {@code true} wenn abgelaufen
     */
    public boolean isExpired(Instant now) {
        return Ttls.isExpired(createdAt, ttl, now);
    }
}

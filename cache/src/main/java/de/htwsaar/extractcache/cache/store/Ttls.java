package de.htwsaar.extractcache.cache.store;

import java.time.Duration;
import java.time.Instant;

/**
 * TTL-Regeln, die alle Backends teilen.
 *
 * <p>{@code null} bedeutet "läuft nie ab". Null- oder negative Dauern sind ungültig.</p>
 */
public final class Ttls {

    private Ttls() {}

    /**
     * @param ttl zu prüfende TTL
     * @return die TTL unverändert
     * @throws IllegalArgumentException bei null- oder negativer Dauer
     */
    public static Duration requireValid(Duration ttl) {
        if (ttl != null && (ttl.isZero() || ttl.isNegative())) {
            throw new IllegalArgumentException("ttl must be positive or null (never expires) but was " + ttl);
        }
        return ttl;
    }

    /**
     * Wandelt eine Sekundenangabe aus der Konfiguration um; {@code 0} bedeutet unbegrenzt.
     *
     * @param seconds Sekunden (auch Bruchteile)
     * @return TTL oder {@code null}
     */
    public static Duration fromConfigSeconds(double seconds) {
        if (seconds < 0) {
            throw new IllegalArgumentException("ttl-seconds must not be negative but was " + seconds);
        }
        if (seconds == 0) {
            return null;
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }

    static boolean isExpired(Instant createdAt, Duration ttl, Instant now) {
        if (ttl == null) {
            return false;
        }
        return Duration.between(createdAt, now).compareTo(ttl) > 0;
    }

    static Double toSeconds(Duration ttl) {
        return ttl == null ? null : ttl.toNanos() / 1_000_000_000.0;
    }

    static Duration fromSeconds(Double seconds) {
        if (seconds == null || seconds <= 0) {
            return null;
        }
        return Duration.ofNanos(Math.round(seconds * 1_000_000_000L));
    }
}

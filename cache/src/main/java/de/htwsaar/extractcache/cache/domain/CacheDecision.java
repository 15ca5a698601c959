package de.htwsaar.extractcache.cache.domain;

/**
 * Fachliche Entscheidung, ob ein Ergebnis aus dem Cache stammt.
 */
public enum CacheDecision {
    HIT,
    MISS
}

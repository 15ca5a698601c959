package de.htwsaar.extractcache.cache.domain;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;

/**
 * Ergebnis einer (ggf. gecachten) Extraktion.
 *
 * @param value       Ergebniswert
 * @param fingerprint verwendeter Cache-Schlüssel, {@code null} wenn keiner gebildet werden konnte
 * @param decision    HIT oder MISS
 */
public record ExtractionResult(JsonNode value, Fingerprint fingerprint, CacheDecision decision) {}

package de.htwsaar.extractcache.cache.service;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.domain.CacheDecision;
import de.htwsaar.extractcache.cache.domain.ExtractionRequest;
import de.htwsaar.extractcache.cache.domain.ExtractionResult;
import de.htwsaar.extractcache.cache.domain.Extractor;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import de.htwsaar.extractcache.cache.key.FingerprintDeriver;
import de.htwsaar.extractcache.cache.store.ResultCache;
import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fachlicher Service: liefert Extraktionsergebnisse aus dem Cache oder vom Provider.
 *
 * <p>Der Cache ist nur Beschleuniger. Fehler des Caches werden protokolliert und wie ein Miss
 * behandelt, Fehler des {@link Extractor} dagegen unverändert weitergereicht (dann wird nichts
 * gecacht).</p>
 */
public class CachedExtractionService {

    private static final Logger log = LoggerFactory.getLogger(CachedExtractionService.class);

    private final Extractor extractor;
    private final ResultCache cache;
    private final Duration ttlOverride;

    /**
     * Erstellt den Service; Einträge bekommen die Standard-TTL des Backends.
     *
     * @param extractor Port zum Provider (darf nicht {@code null} sein)
     * @param cache     Backend (darf nicht {@code null} sein)
     */
    public CachedExtractionService(Extractor extractor, ResultCache cache) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.ttlOverride = null;
    }

    /**
     * Erstellt den Service mit eigener TTL für alle neuen Einträge.
     *
     * @param extractor Port zum Provider
     * @param cache     Backend
     * @param ttl       TTL für neue Einträge
     */
    public CachedExtractionService(Extractor extractor, ResultCache cache, Duration ttl) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.ttlOverride = Objects.requireNonNull(ttl, "ttl must not be null");
    }

    /**
     * Liefert das Ergebnis aus dem Cache oder ruft den Provider auf und cacht das Ergebnis.
     *
     * <p>Lässt sich kein Schlüssel bilden (z. B. nicht serialisierbares Schema), läuft die Extraktion
     * ohne Cache; das Ergebnis hat dann keinen Fingerprint.</p>
     *
     * @param request Anfrage
     * @return Ergebnis mit HIT/MISS-Entscheidung
     */
    public ExtractionResult extract(ExtractionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Fingerprint key = fingerprint(request);
        if (key == null) {
            return new ExtractionResult(extractor.extract(request), null, CacheDecision.MISS);
        }

        JsonNode cached = lookup(key);
        if (cached != null) {
            log.debug("Cache hit for {}", key);
            return new ExtractionResult(cached, key, CacheDecision.HIT);
        }

        log.debug("Cache miss for {}, calling provider {}", key, key.provider());
        JsonNode value = extractor.extract(request);
        if (value != null) {
            store(key, value);
        }
        return new ExtractionResult(value, key, CacheDecision.MISS);
    }

    /**
     * Typisierte Variante: konvertiert das Ergebnis per Jackson in {@code type}.
     *
     * @param request Anfrage
     * @param type    Zieltyp
     * @return konvertiertes Ergebnis oder {@code null} wenn der Provider nichts geliefert hat
     */
    public <T> T extract(ExtractionRequest request, Class<T> type) {
        JsonNode value = extract(request).value();
        return value == null ? null : JacksonCodec.fromTree(value, type);
    }

    private static Fingerprint fingerprint(ExtractionRequest request) {
        try {
            return FingerprintDeriver.derive(
                    request.document(), request.prompt(), request.schema(), request.provider(), request.model());
        } catch (RuntimeException e) {
            log.warn("Unable to derive cache key for provider {}, extracting uncached", request.provider(), e);
            return null;
        }
    }

    private JsonNode lookup(Fingerprint key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache lookup failed for {}, treating as miss", key, e);
            return null;
        }
    }

    private void store(Fingerprint key, JsonNode value) {
        try {
            if (ttlOverride != null) {
                cache.set(key, value, ttlOverride);
            } else {
                cache.set(key, value);
            }
        } catch (RuntimeException e) {
            log.warn("Cache write failed for {}, result is returned uncached", key, e);
        }
    }
}

package de.htwsaar.extractcache.cache.domain;

import java.util.Objects;

/**
 * Eingaben einer Extraktion, aus denen auch der Cache-Schlüssel abgeleitet wird.
 *
 * @param document Dokument-Bytes
 * @param prompt   Extraktions-Anweisung
 * @param schema   erwartete Ausgabeform (wird nur gehasht)
 * @param provider Provider-Kennung
 * @param model    Modell-Kennung oder {@code null}
 */
public record ExtractionRequest(byte[] document, String prompt, Object schema, String provider, String model) {

    public ExtractionRequest {
        Objects.requireNonNull(document, "document must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
    }
}

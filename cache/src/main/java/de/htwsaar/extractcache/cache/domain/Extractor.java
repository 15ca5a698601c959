package de.htwsaar.extractcache.cache.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Port zum (teuren, nicht-deterministischen) Extraktions-Provider.
 *
 * <p>Implementierungen liegen außerhalb dieses Moduls, z. B. HTTP-Clients für Gemini oder OpenAI.</p>
 */
@FunctionalInterface
public interface Extractor {

    /**
     * Führt die Extraktion aus.
     *
     * @param request Anfrage mit Dokument, Prompt und Schema
     * @return strukturiertes Ergebnis
     */
    JsonNode extract(ExtractionRequest request);
}

package de.htwsaar.extractcache.cache.key;

import de.htwsaar.extractcache.common.serialization.JacksonCodec;
import de.htwsaar.extractcache.common.util.Sha256Util;
import java.util.Objects;

/**
 * Leitet aus den Rohdaten einer Extraktionsanfrage einen stabilen {@link Fingerprint} ab.
 *
 * <p>Jede Komponente wird separat mit SHA-256 gehasht, damit z. B. {@code "ab"+"c"} und
 * {@code "a"+"bc"} nicht kollidieren. Das Schema wird vorher in kanonisches JSON mit sortierten
 * Schlüsseln überführt. Reine Funktion ohne Seiteneffekte.</p>
 */
public final class FingerprintDeriver {

    private FingerprintDeriver() {}

    /**
     * Berechnet den Fingerprint.
     *
     * @param documentBytes Inhalt des Dokuments (nicht der Pfad)
     * @param prompt        Extraktions-Anweisung
     * @param schema        erwartete Ausgabeform (Map, Record, JsonNode, ... oder {@code null})
     * @param provider      Provider-Kennung
     * @param model         Modell-Kennung oder {@code null}
     * @return Fingerprint
     */
    public static Fingerprint derive(byte[] documentBytes, String prompt, Object schema, String provider, String model) {
        Objects.requireNonNull(documentBytes, "documentBytes must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(provider, "provider must not be null");

        return new Fingerprint(
                Sha256Util.sha256Hex(documentBytes),
                Sha256Util.sha256Hex(prompt),
                schemaHash(schema),
                provider,
                model);
    }

    /**
     * Variante ohne Modellangabe.
     */
    public static Fingerprint derive(byte[] documentBytes, String prompt, Object schema, String provider) {
        return derive(documentBytes, prompt, schema, provider, null);
    }

    /**
     * Hash der kanonischen JSON-Form eines Schemas.
     *
     * @param schema Schema-Beschreibung oder {@code null}
     * @return SHA-256 Hex
     */
    public static String schemaHash(Object schema) {
        return Sha256Util.sha256Hex(JacksonCodec.toCanonicalJson(schema));
    }
}

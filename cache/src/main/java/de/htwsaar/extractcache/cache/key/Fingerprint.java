package de.htwsaar.extractcache.cache.key;

import java.util.Locale;
import java.util.Objects;

/**
 * Unveränderlicher Cache-Schlüssel einer Extraktionsanfrage.
 *
 * <p>Gleichheit und {@code hashCode} ergeben sich aus allen fünf Komponenten. Provider und Modell
 * werden beim Erzeugen auf Kleinbuchstaben normalisiert, ein fehlendes Modell wird zum Leerstring.</p>
 *
 * @param contentHash Hash der Dokument-Bytes
 * @param promptHash  Hash des Prompt-Textes
 * @param schemaHash  Hash der kanonischen Schema-Beschreibung
 * @param provider    Provider-Kennung (lower case)
 * @param model       Modell-Kennung (lower case, leer wenn unbekannt)
 */
public record Fingerprint(String contentHash, String promptHash, String schemaHash, String provider, String model) {

    /** Trennzeichen der kanonischen Textform. */
    public static final String DELIMITER = ":";

    public Fingerprint {
        contentHash = requireComponent(contentHash, "contentHash");
        promptHash = requireComponent(promptHash, "promptHash");
        schemaHash = requireComponent(schemaHash, "schemaHash");
        provider = requireComponent(provider, "provider").toLowerCase(Locale.ROOT);
        // model ist das letzte Segment und darf ':' enthalten (z. B. "llama3:8b")
        model = model == null ? "" : model.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Erzeugt einen Fingerprint ohne Modellangabe.
     */
    public Fingerprint(String contentHash, String promptHash, String schemaHash, String provider) {
        this(contentHash, promptHash, schemaHash, provider, "");
    }

    /**
     * Kanonische Textform {@code content:prompt:schema:provider[:model]}.
     *
     * <p>Wird als Persistenz-Identität (SQLite-Schlüssel) und als Basis für Dateinamen verwendet.
     * Ohne Modell entfällt das letzte Segment.</p>
     *
     * @return Schlüssel als String
     */
    public String toKeyString() {
        String base = String.join(DELIMITER, contentHash, promptHash, schemaHash, provider);
        return model.isEmpty() ? base : base + DELIMITER + model;
    }

    /**
     * Liest die kanonische Textform wieder ein.
     *
     * @param key Text aus {@link #toKeyString()}
     * @return Fingerprint
     * @throws IllegalArgumentException wenn der Text nicht 4 oder 5 Segmente hat
     */
    public static Fingerprint parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        String[] parts = key.trim().split(DELIMITER, 5);
        if (parts.length == 4) {
            return new Fingerprint(parts[0], parts[1], parts[2], parts[3]);
        }
        if (parts.length == 5) {
            return new Fingerprint(parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        throw new IllegalArgumentException("Expected 4 or 5 ':'-separated segments but got " + parts.length);
    }

    @Override
    public String toString() {
        return toKeyString();
    }

    private static String requireComponent(String value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        String v = value.trim();
        if (v.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        if (v.contains(DELIMITER)) {
            throw new IllegalArgumentException(name + " must not contain '" + DELIMITER + "'");
        }
        return v;
    }
}

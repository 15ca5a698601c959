package de.htwsaar.extractcache.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * SHA-256 Hilfsfunktionen für Fingerprints und Dateinamen.
 */
public final class Sha256Util {

    private Sha256Util() {}

    /**
     * Berechnet den SHA-256 Hash über rohe Bytes.
     *
     * @param data Eingabe (darf nicht {@code null} sein)
     * @return Hash als 64-stelliger Hex-String (Kleinbuchstaben)
     */
    public static String sha256Hex(byte[] data) {
        Objects.requireNonNull(data, "data must not be null");
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    /**
     * Berechnet den SHA-256 Hash über die UTF-8-Kodierung eines Textes.
     *
     * @param text Eingabe (darf nicht {@code null} sein)
     * @return Hash als Hex-String
     */
    public static String sha256Hex(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return sha256Hex(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

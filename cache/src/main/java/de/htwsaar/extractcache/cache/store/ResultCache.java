package de.htwsaar.extractcache.cache.store;

import com.fasterxml.jackson.databind.JsonNode;
import de.htwsaar.extractcache.cache.key.Fingerprint;
import java.time.Duration;

/**
 * Abstraktion des Ergebnis-Caches.
 * Ermöglicht den Austausch von Memory/File/SQLite ohne Anpassung der aufrufenden Extraktions-Schicht.
 *
 * <p>Der Cache ist eine reine Optimierung: Lese- und Schreibfehler zur Laufzeit werden intern in
 * Misses umgewandelt und nie an den Aufrufer weitergereicht. Nur der Aufbau eines persistenten
 * Backends darf mit {@link CacheStorageException} fehlschlagen.</p>
 *
 * <p>Alle Operationen laufen synchron im Thread des Aufrufers; File- und SQLite-Backends machen
 * blockierendes I/O.</p>
 */
public interface ResultCache {

    /**
     * Gibt einen frischen Wert zurück oder {@code null} wenn abgelaufen/nicht vorhanden/unlesbar.
     *
     * @param key Fingerprint
     * @return gespeicherter Wert oder {@code null}
     */
    JsonNode get(Fingerprint key);

    /**
     * Speichert einen Wert mit der Standard-TTL des Backends.
     *
     * @param key   Fingerprint
     * @param value zu cachender Wert
     */
    void set(Fingerprint key, JsonNode value);

    /**
     * Speichert einen Wert mit expliziter TTL.
     *
     * @param key   Fingerprint
     * @param value zu cachender Wert
     * @param ttl   Lebensdauer, {@code null} = läuft nie ab
     */
    void set(Fingerprint key, JsonNode value, Duration ttl);

    /**
     * Entfernt einen einzelnen Eintrag.
     *
     * @param key Fingerprint
     * @return {@code true} wenn ein Eintrag entfernt wurde
     */
    boolean delete(Fingerprint key);

    /**
     * Leert den gesamten Cache. Hit/Miss-Zähler bleiben erhalten.
     *
     * @return Anzahl entfernter Einträge
     */
    int clear();

    /**
     * Entfernt alle abgelaufenen Einträge.
     *
     * @return Anzahl entfernter Einträge
     */
    int cleanupExpired();

    /**
     * Momentaufnahme von Größe und Zählern.
     *
     * @return Statistik
     */
    CacheStats stats();
}

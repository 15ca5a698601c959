package de.htwsaar.extractcache.cache.store;

/**
 * Persistenter Cache-Speicher ist nicht verfügbar (Verzeichnis oder Datenbank nicht anlegbar/öffnbar).
 * Wird nur beim Aufbau eines Backends geworfen.
 */
public class CacheStorageException extends RuntimeException {

    private final String location;

    /**
     * @param message  Fehlerbeschreibung
     * @param location betroffener Pfad
     * @param cause    Ursache
     */
    public CacheStorageException(String message, String location, Throwable cause) {
        super(message + " [" + location + "]", cause);
        this.location = location;
    }

    /**
     * @return betroffener Pfad
     */
    public String getLocation() {
        return location;
    }
}

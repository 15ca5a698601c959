package de.htwsaar.extractcache.common.serialization;

public class ExtractCacheSerializationException extends RuntimeException {

    public ExtractCacheSerializationException(String message) {

        super(message);
    }

    public ExtractCacheSerializationException(String message, Throwable cause) {

        super(message, cause);
    }
}

package de.htwsaar.datalinker.datalink.domain;

/**
 * Fehler beim Zugriff auf die Dataset-Registry (Timeout, 5xx, unlesbare Antwort).
 */
public class StorageLookupException extends DatalinkException {

    public StorageLookupException(String message) {
        super(message);
    }

    public StorageLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}

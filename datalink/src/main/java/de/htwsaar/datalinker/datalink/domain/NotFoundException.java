package de.htwsaar.datalinker.datalink.domain;

/**
 * Kein Objekt zum Identifier vorhanden. Wird zur Fehlerzeile, nicht zum Request-Fehler.
 */
public class NotFoundException extends StorageLookupException {

    public NotFoundException(String message) {
        super(message);
    }
}

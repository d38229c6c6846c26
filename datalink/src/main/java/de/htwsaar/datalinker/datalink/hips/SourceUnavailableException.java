package de.htwsaar.datalinker.datalink.hips;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;

/**
 * Quelle der Collection-Liste nicht erreichbar. Bleibt lokal im Refresh, Leser sehen weiter alte Daten.
 */
public class SourceUnavailableException extends DatalinkException {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

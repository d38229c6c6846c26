package de.htwsaar.datalinker.datalink.link;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;

/**
 * Programmierfehler: eine Zeile verletzt die Genau-eins-Regel oder verweist auf einen
 * unbekannten Service-Deskriptor.
 */
public class MalformedEntryException extends DatalinkException {

    public MalformedEntryException(String message) {
        super(message);
    }
}

package de.htwsaar.datalinker.datalink.identifier;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;

/**
 * Identifier konnte nicht geparst werden oder hat nicht die geforderte Art.
 * Bricht die gesamte Anfrage ab (Client-Fehler, HTTP 422).
 */
public class InvalidIdentifierException extends DatalinkException {

    private final String identifier;

    public InvalidIdentifierException(String identifier, String reason) {
        super("Unable to extract valid dataset ID from " + identifier + ": " + reason);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}

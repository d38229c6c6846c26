package de.htwsaar.datalinker.datalink.hips;

import de.htwsaar.datalinker.datalink.domain.DatalinkException;

/**
 * Die Collection-Liste wurde noch nie erfolgreich befüllt ("not yet available", HTTP 503).
 */
public class CollectionListUnavailableException extends DatalinkException {

    public CollectionListUnavailableException(String listName) {
        super("Collection list '" + listName + "' is not yet available");
    }
}

package de.htwsaar.datalinker.datalink.hips;

/**
 * Port zur Quelle einer Collection-Liste. Die Quelle zählt die vollständige Collection-Menge auf.
 */
public interface CollectionSource {

    /**
     * @return aktuelle Collections plus Schlüssel, die vorübergehend nicht lieferbar waren
     * @throws SourceUnavailableException wenn die Quelle gar nichts liefern konnte
     */
    CollectionListing listCollections();
}

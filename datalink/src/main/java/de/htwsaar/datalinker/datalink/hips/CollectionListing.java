package de.htwsaar.datalinker.datalink.hips;

import java.util.List;
import java.util.Set;

/**
 * Ergebnis eines Quellen-Abrufs.
 *
 * @param records         erfolgreich abgerufene Collections in Quellreihenfolge
 * @param unavailableKeys Collections, die die Quelle kennt, aber gerade nicht liefern konnte
 */
public record CollectionListing(List<CollectionRecord> records, Set<String> unavailableKeys) {

    public CollectionListing {
        records = List.copyOf(records);
        unavailableKeys = Set.copyOf(unavailableKeys);
    }

    public static CollectionListing complete(List<CollectionRecord> records) {
        return new CollectionListing(records, Set.of());
    }
}

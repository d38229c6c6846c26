package de.htwsaar.datalinker.datalink.hips;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unveränderlicher Stand einer Collection-Liste. Wird als Ganzes ersetzt, nie in-place geändert.
 *
 * @param entries       Schlüssel → Eintrag in Quellreihenfolge
 * @param lastSuccess   Zeitpunkt des letzten erfolgreichen Refreshs, {@code null} solange leer
 * @param healthy       {@code false} nach fehlgeschlagenem oder unvollständigem Refresh
 * @param lastError     letzte Fehlermeldung oder {@code null}
 */
public record CollectionListSnapshot(
        Map<String, CollectionListEntry> entries, Instant lastSuccess, boolean healthy, String lastError) {

    private static final CollectionListSnapshot EMPTY = new CollectionListSnapshot(Map.of(), null, true, null);

    public CollectionListSnapshot {
        entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static CollectionListSnapshot empty() {
        return EMPTY;
    }

    /** Noch nie erfolgreich befüllt. */
    public boolean isEmpty() {
        return lastSuccess == null;
    }

    CollectionListSnapshot withFailure(String error) {
        return new CollectionListSnapshot(entries, lastSuccess, false, error);
    }
}

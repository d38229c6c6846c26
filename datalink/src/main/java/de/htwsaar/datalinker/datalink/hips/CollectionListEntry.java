package de.htwsaar.datalinker.datalink.hips;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Unveränderlicher Eintrag einer Collection-Liste (z. B. die Properties einer HiPS-Collection).
 *
 * @param key          Collection-Schlüssel (z. B. {@code images/band_g})
 * @param canonicalUrl kanonische URL der Collection
 * @param properties   Properties in Originalreihenfolge
 * @param text         Properties-Block im Wortlaut
 * @param refreshedAt  Zeitpunkt des letzten erfolgreichen Abrufs
 */
public record CollectionListEntry(
        String key, String canonicalUrl, Map<String, String> properties, String text, Instant refreshedAt) {

    public CollectionListEntry {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(canonicalUrl, "canonicalUrl must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(refreshedAt, "refreshedAt must not be null");
        // Reihenfolge erhalten, trotzdem unveränderlich
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
}

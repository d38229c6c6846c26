package de.htwsaar.datalinker.datalink.hips;

import java.util.Map;
import java.util.Objects;

/**
 * Roher Datensatz der {@link CollectionSource}, noch ohne Zeitstempel.
 *
 * @param key          Collection-Schlüssel
 * @param canonicalUrl kanonische URL
 * @param properties   Properties in Originalreihenfolge
 * @param text         Properties-Block im Wortlaut, wie er in der HiPS-Liste erscheint
 */
public record CollectionRecord(String key, String canonicalUrl, Map<String, String> properties, String text) {

    public CollectionRecord {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(canonicalUrl, "canonicalUrl must not be null");
        Objects.requireNonNull(properties, "properties must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /** Datensatz ohne Originaltext; der Block wird aus den Properties formatiert. */
    public CollectionRecord(String key, String canonicalUrl, Map<String, String> properties) {
        this(key, canonicalUrl, properties, HipsPropertiesFormat.format(properties));
    }
}

package de.htwsaar.datalinker.datalink.tap;

import java.util.Locale;

/**
 * Umfang der zurückgegebenen Spalten.
 */
public enum Detail {
    MINIMAL("lsst:minimal"),
    PRINCIPAL("tap:principal"),
    FULL(null);

    private final String metadataKey;

    Detail(String metadataKey) {
        this.metadataKey = metadataKey;
    }

    /** Schlüssel der Spaltenliste in den TAP-Metadaten, {@code null} für alle Spalten. */
    public String metadataKey() {
        return metadataKey;
    }

    public static Detail parse(String value) {
        return Detail.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}

package de.htwsaar.datalinker.datalink.render;

import java.time.Duration;
import java.util.Objects;

/**
 * Gerenderte DataLink-Antwort inkl. Cache-Vorgabe.
 *
 * @param body   VOTable-Dokument
 * @param maxAge Wert für {@code Cache-Control: max-age}, nie negativ
 */
public record DataLinkDocument(String body, Duration maxAge) {

    /** Media-Type einer DataLink-Antwort. */
    public static final String MEDIA_TYPE = "application/x-votable+xml";

    public DataLinkDocument {
        Objects.requireNonNull(body, "body must not be null");
        Objects.requireNonNull(maxAge, "maxAge must not be null");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must not be negative");
        }
    }
}

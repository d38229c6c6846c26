package de.htwsaar.datalinker.datalink.domain;

import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Byte-adressierbares Objekt, auf das ein Identifier aufgelöst wurde.
 *
 * @param uri         Speicherort ({@code https://…} bereits signiert, oder {@code s3://bucket/key} u. ä.)
 * @param size        Größe in Bytes, {@code null} wenn unbekannt
 * @param datasetType Dataset-Typ laut Registry (z. B. {@code calexp}, {@code raw}), optional
 * @param contentType MIME-Type, optional
 * @param expiresAt   Ablauf einer bereits signierten URI, {@code null} wenn nicht gemeldet
 */
public record ObjectReference(URI uri, Long size, String datasetType, String contentType, Instant expiresAt) {

    /** Dataset-Typ für Rohaufnahmen; für diese werden keine Cutouts angeboten. */
    public static final String RAW_DATASET_TYPE = "raw";

    public ObjectReference {
        Objects.requireNonNull(uri, "uri must not be null");
        if (size != null && size < 0) {
            throw new IllegalArgumentException("size must not be negative");
        }
    }

    /**
     * @return {@code true} für Rohaufnahmen
     */
    public boolean isRaw() {
        return RAW_DATASET_TYPE.equals(datasetType);
    }

    /**
     * @return URI-Schema in Kleinbuchstaben, leer wenn keines gesetzt ist
     */
    public String scheme() {
        return uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    }
}

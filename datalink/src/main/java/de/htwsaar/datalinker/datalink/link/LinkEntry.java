package de.htwsaar.datalinker.datalink.link;

import java.util.Objects;

/**
 * Eine Zeile der DataLink-Tabelle.
 *
 * <p>Wohlgeformt ist eine Zeile genau dann, wenn genau eines von {@code accessUrl},
 * {@code serviceDef} und {@code errorMessage} nicht leer ist. Die Fabrikmethoden erzeugen
 * nur wohlgeformte Zeilen; der Konstruktor prüft das bewusst nicht, damit der Renderer
 * fehlerhafte Zeilen erkennen und ablehnen kann.</p>
 *
 * @param id            Identifier der Anfrage (in jeder Zeile identisch)
 * @param accessUrl     direkte URL oder {@code null}
 * @param serviceDef    ID eines Service-Deskriptors oder {@code null}
 * @param errorMessage  Fehlertext oder {@code null}
 * @param description   Beschreibung
 * @param semantics     Semantik, siehe {@link Semantics}
 * @param contentType   MIME-Type oder {@code null}
 * @param contentLength Größe in Bytes oder {@code null} wenn unbekannt
 */
public record LinkEntry(
        String id,
        String accessUrl,
        String serviceDef,
        String errorMessage,
        String description,
        String semantics,
        String contentType,
        Long contentLength) {

    public LinkEntry {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(semantics, "semantics must not be null");
    }

    public static LinkEntry ofAccessUrl(
            String id, String accessUrl, String description, String semantics, String contentType, Long contentLength) {
        return new LinkEntry(
                id,
                Objects.requireNonNull(accessUrl, "accessUrl must not be null"),
                null,
                null,
                description,
                semantics,
                contentType,
                contentLength);
    }

    public static LinkEntry ofServiceDef(
            String id, String serviceDef, String description, String semantics, String contentType) {
        return new LinkEntry(
                id,
                null,
                Objects.requireNonNull(serviceDef, "serviceDef must not be null"),
                null,
                description,
                semantics,
                contentType,
                null);
    }

    public static LinkEntry ofError(String id, String errorMessage, String description, String semantics) {
        return new LinkEntry(
                id,
                null,
                null,
                Objects.requireNonNull(errorMessage, "errorMessage must not be null"),
                description,
                semantics,
                null,
                null);
    }

    /**
     * @return Anzahl der gesetzten Ziel-Felder (URL, Service, Fehler)
     */
    public int populatedTargets() {
        return (isSet(accessUrl) ? 1 : 0) + (isSet(serviceDef) ? 1 : 0) + (isSet(errorMessage) ? 1 : 0);
    }

    public boolean isWellFormed() {
        return populatedTargets() == 1;
    }

    public boolean isError() {
        return isSet(errorMessage);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isEmpty();
    }
}

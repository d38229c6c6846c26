package de.htwsaar.datalinker.datalink.identifier;

import java.util.Objects;
import java.util.Optional;

/**
 * Geparster, unveränderlicher Identifier.
 *
 * @param raw       Originaltext (wird unverändert in jede Tabellenzeile übernommen)
 * @param kind      erkannte Art
 * @param scheme    Schema in Kleinbuchstaben (z. B. {@code butler}, {@code img})
 * @param namespace Repository-Label bzw. Tabellenname, {@code null} wenn das Schema keinen kennt
 * @param localId   lokaler Teil (UUID, Token oder Zeilen-ID)
 */
public record Identifier(String raw, IdentifierKind kind, String scheme, String namespace, String localId) {

    public Identifier {
        Objects.requireNonNull(raw, "raw must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(scheme, "scheme must not be null");
        Objects.requireNonNull(localId, "localId must not be null");
    }

    /**
     * Deployment-Label für die Auswahl von Backend-Endpunkten (z. B. Cutout-Service).
     *
     * @return Label oder leer, wenn der Identifier keines trägt
     */
    public Optional<String> deployment() {
        return "butler".equals(scheme) ? Optional.ofNullable(namespace) : Optional.empty();
    }

    @Override
    public String toString() {
        return raw;
    }
}

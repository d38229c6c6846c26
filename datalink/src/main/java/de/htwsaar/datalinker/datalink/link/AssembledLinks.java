package de.htwsaar.datalinker.datalink.link;

import de.htwsaar.datalinker.datalink.identifier.Identifier;
import de.htwsaar.datalinker.datalink.signing.ExpiryWindow;
import java.util.List;
import java.util.Objects;

/**
 * Ergebnis einer Link-Zusammenstellung: Zeilen in Ausgabe-Reihenfolge, registrierte Deskriptoren
 * und das Ablauf-Fenster der signierten URLs.
 */
public record AssembledLinks(
        Identifier identifier, List<LinkEntry> entries, List<ServiceDescriptor> descriptors, ExpiryWindow window) {

    public AssembledLinks {
        Objects.requireNonNull(identifier, "identifier must not be null");
        Objects.requireNonNull(window, "window must not be null");
        entries = List.copyOf(entries);
        descriptors = List.copyOf(descriptors);
    }
}

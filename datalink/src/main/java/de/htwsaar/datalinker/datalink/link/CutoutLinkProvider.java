package de.htwsaar.datalinker.datalink.link;

import de.htwsaar.datalinker.datalink.domain.CutoutLocator;
import de.htwsaar.datalinker.datalink.domain.CutoutUnavailableException;
import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.identifier.Identifier;
import de.htwsaar.datalinker.datalink.identifier.IdentifierKind;
import java.net.URI;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Liefert die {@code #cutout}-Zeile samt SODA-sync-Deskriptor für Bilder.
 */
public class CutoutLinkProvider implements OptionalLinkProvider {

    private static final Logger log = LoggerFactory.getLogger(CutoutLinkProvider.class);

    public static final String DESCRIPTOR_ID = "cutout-sync";
    public static final String SODA_SYNC_STANDARD_ID = "ivo://ivoa.net/std/SODA#sync-1.0";
    static final String DESCRIPTION = "Cutout service for this image";
    static final String CONTENT_TYPE = "application/fits";

    private final CutoutLocator locator;

    public CutoutLinkProvider(CutoutLocator locator) {
        this.locator = Objects.requireNonNull(locator, "locator must not be null");
    }

    @Override
    public Capability capability() {
        return Capability.CUTOUT;
    }

    @Override
    public boolean appliesTo(Identifier identifier, ObjectReference primary) {
        if (identifier.kind() != IdentifierKind.IMAGE) return false;
        // Rohaufnahmen unterstützen keine Cutouts
        return primary == null || !primary.isRaw();
    }

    @Override
    public ProvidedLink provide(Identifier identifier) {
        URI endpoint;
        try {
            endpoint = locator.endpointFor(identifier.deployment().orElse(null));
        } catch (CutoutUnavailableException e) {
            log.warn("Cutout endpoint unavailable for {}: {}", identifier, e.getMessage());
            LinkEntry error = LinkEntry.ofError(
                    identifier.raw(), Fault.NOT_FOUND.message(e.getMessage()), DESCRIPTION, Semantics.CUTOUT);
            return new ProvidedLink(error, null);
        }

        LinkEntry entry =
                LinkEntry.ofServiceDef(identifier.raw(), DESCRIPTOR_ID, DESCRIPTION, Semantics.CUTOUT, CONTENT_TYPE);
        return new ProvidedLink(entry, descriptor(identifier, endpoint));
    }

    /** Parameter-Reihenfolge: ID, POLYGON, CIRCLE. */
    static ServiceDescriptor descriptor(Identifier identifier, URI endpoint) {
        return new ServiceDescriptor(
                DESCRIPTOR_ID,
                SODA_SYNC_STANDARD_ID,
                endpoint.toString(),
                List.of(
                        new ServiceParameter("ID", "char", "*", null, "meta.id;meta.dataset", null, identifier.raw()),
                        new ServiceParameter("POLYGON", "double", "*", "deg", "obs.field;pos", "polygon", ""),
                        new ServiceParameter("CIRCLE", "double", "3", "deg", "obs.field;pos", "circle", "")));
    }
}

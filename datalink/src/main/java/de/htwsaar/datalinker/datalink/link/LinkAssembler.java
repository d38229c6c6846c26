package de.htwsaar.datalinker.datalink.link;

import de.htwsaar.datalinker.datalink.domain.NotFoundException;
import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.SignedUrl;
import de.htwsaar.datalinker.datalink.domain.SigningException;
import de.htwsaar.datalinker.datalink.domain.StorageLookupException;
import de.htwsaar.datalinker.datalink.domain.StorageResolver;
import de.htwsaar.datalinker.datalink.identifier.Identifier;
import de.htwsaar.datalinker.datalink.identifier.IdentifierKind;
import de.htwsaar.datalinker.datalink.signing.ExpiryAwareSigner;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stellt die Zeilen einer DataLink-Antwort zusammen.
 *
 * <p>Immer zuerst die {@code #this}-Zeile, danach die optionalen Links in der Deklarations-Reihenfolge
 * von {@link Capability}. Fehler einzelner Backends werden zu Fehlerzeilen; die Antwort wird
 * trotzdem vollständig erzeugt. Keine eigenen Retries.</p>
 *
 * <p>Zustandslos: beliebig viele Requests dürfen parallel zusammenstellen.</p>
 */
public class LinkAssembler {

    private static final Logger log = LoggerFactory.getLogger(LinkAssembler.class);

    static final String DEFAULT_IMAGE_CONTENT_TYPE = "application/fits";
    static final String DEFAULT_ROW_CONTENT_TYPE = "application/x-votable+xml";

    private final StorageResolver storageResolver;
    private final ExpiryAwareSigner signer;
    private final List<OptionalLinkProvider> providers;

    /**
     * @param storageResolver Port zur Dataset-Registry
     * @param signer          Signierer mit Ablauf-Tracking
     * @param providers       Capability-Tabelle; Reihenfolge wird auf die Deklaration von {@link Capability} normiert
     */
    public LinkAssembler(StorageResolver storageResolver, ExpiryAwareSigner signer, List<OptionalLinkProvider> providers) {
        this.storageResolver = Objects.requireNonNull(storageResolver, "storageResolver must not be null");
        this.signer = Objects.requireNonNull(signer, "signer must not be null");
        List<OptionalLinkProvider> sorted = new ArrayList<>(providers);
        sorted.sort(Comparator.comparing(OptionalLinkProvider::capability));
        this.providers = List.copyOf(sorted);
    }

    /**
     * @param identifier   bereits klassifizierter Identifier
     * @param capabilities in diesem Deployment aktivierte optionale Link-Arten
     * @return Zeilen, Deskriptoren und Ablauf-Fenster
     */
    public AssembledLinks assemble(Identifier identifier, Set<Capability> capabilities) {
        Set<Capability> enabled = capabilities.isEmpty() ? EnumSet.noneOf(Capability.class) : EnumSet.copyOf(capabilities);
        ExpiryAwareSigner.Session session = signer.openSession();

        List<LinkEntry> entries = new ArrayList<>();
        List<ServiceDescriptor> descriptors = new ArrayList<>();

        ObjectReference primary = null;
        try {
            primary = storageResolver.locate(identifier);
            SignedUrl url = session.sign(primary);
            entries.add(LinkEntry.ofAccessUrl(
                    identifier.raw(),
                    url.url(),
                    primaryDescription(identifier),
                    Semantics.THIS,
                    primary.contentType() != null ? primary.contentType() : defaultContentType(identifier),
                    primary.size()));
        } catch (NotFoundException e) {
            log.warn("Primary artifact not found for {}: {}", identifier, e.getMessage());
            entries.add(primaryError(identifier, Fault.NOT_FOUND.message(e.getMessage())));
        } catch (SigningException e) {
            log.warn("Signing failed for {}: {}", identifier, e.getMessage());
            entries.add(primaryError(identifier, Fault.FATAL.message(e.getMessage())));
        } catch (StorageLookupException e) {
            log.warn("Storage lookup failed for {}: {}", identifier, e.getMessage());
            entries.add(primaryError(identifier, Fault.TRANSIENT.message(e.getMessage())));
        }

        for (OptionalLinkProvider provider : providers) {
            if (!enabled.contains(provider.capability()) || !provider.appliesTo(identifier, primary)) {
                continue;
            }
            OptionalLinkProvider.ProvidedLink link = provider.provide(identifier);
            entries.add(link.entry());
            if (link.descriptor() != null) {
                descriptors.add(link.descriptor());
            }
        }

        return new AssembledLinks(identifier, entries, descriptors, session.window());
    }

    private static LinkEntry primaryError(Identifier identifier, String message) {
        return LinkEntry.ofError(identifier.raw(), message, primaryDescription(identifier), Semantics.THIS);
    }

    private static String primaryDescription(Identifier identifier) {
        return identifier.kind() == IdentifierKind.CATALOG_ROW ? "Catalog row data" : "Link to the full image";
    }

    private static String defaultContentType(Identifier identifier) {
        return identifier.kind() == IdentifierKind.CATALOG_ROW ? DEFAULT_ROW_CONTENT_TYPE : DEFAULT_IMAGE_CONTENT_TYPE;
    }
}

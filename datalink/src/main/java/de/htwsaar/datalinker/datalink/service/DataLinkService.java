package de.htwsaar.datalinker.datalink.service;

import de.htwsaar.datalinker.datalink.identifier.Identifier;
import de.htwsaar.datalinker.datalink.identifier.IdentifierResolver;
import de.htwsaar.datalinker.datalink.link.AssembledLinks;
import de.htwsaar.datalinker.datalink.link.Capability;
import de.htwsaar.datalinker.datalink.link.LinkAssembler;
import de.htwsaar.datalinker.datalink.render.DataLinkDocument;
import de.htwsaar.datalinker.datalink.render.VoTableRenderer;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fachlicher Ablauf einer Links-Anfrage: Identifier prüfen, Zeilen zusammenstellen, VOTable rendern.
 */
public class DataLinkService {

    private static final Logger log = LoggerFactory.getLogger(DataLinkService.class);

    private final IdentifierResolver resolver;
    private final LinkAssembler assembler;
    private final VoTableRenderer renderer;
    private final Set<Capability> capabilities;

    /**
     * @param resolver     Identifier-Parser
     * @param assembler    Zusammenstellung der Zeilen
     * @param renderer     VOTable-Ausgabe
     * @param capabilities in diesem Deployment aktivierte optionale Links
     */
    public DataLinkService(
            IdentifierResolver resolver,
            LinkAssembler assembler,
            VoTableRenderer renderer,
            Set<Capability> capabilities) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.assembler = Objects.requireNonNull(assembler, "assembler must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.capabilities = capabilities.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(capabilities);
    }

    /**
     * @param rawIdentifier Wert des {@code ID}-Parameters
     * @return gerendertes Dokument mit Cache-Vorgabe
     * @throws de.htwsaar.datalinker.datalink.identifier.InvalidIdentifierException bei ungültigem
     *         oder nicht verlinkbarem Identifier
     */
    public DataLinkDocument links(String rawIdentifier) {
        Identifier identifier = resolver.require(rawIdentifier, IdentifierResolver.linkableKinds());
        AssembledLinks links = assembler.assemble(identifier, capabilities);
        log.debug("Assembled {} link entries for {}", links.entries().size(), identifier);
        return renderer.render(links);
    }
}

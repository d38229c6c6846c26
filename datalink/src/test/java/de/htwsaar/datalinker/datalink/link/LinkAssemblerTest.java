package de.htwsaar.datalinker.datalink.link;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import de.htwsaar.datalinker.datalink.MutableClock;
import de.htwsaar.datalinker.datalink.adapter.config.ConfiguredCutoutLocator;
import de.htwsaar.datalinker.datalink.domain.NotFoundException;
import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.StorageLookupException;
import de.htwsaar.datalinker.datalink.domain.StorageResolver;
import de.htwsaar.datalinker.datalink.identifier.Identifier;
import de.htwsaar.datalinker.datalink.identifier.IdentifierResolver;
import de.htwsaar.datalinker.datalink.signing.ExpiryAwareSigner;
import de.htwsaar.datalinker.datalink.signing.PassThroughSigner;
import de.htwsaar.datalinker.datalink.signing.SchemeRoutingSigner;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LinkAssemblerTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");
    private static final URI CUTOUT = URI.create("https://example.org/api/cutout/sync");

    private final IdentifierResolver resolver = new IdentifierResolver();
    private StorageResolver storage;
    private LinkAssembler assembler;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        storage = mock(StorageResolver.class);
        PassThroughSigner passThrough = new PassThroughSigner(clock);
        ExpiryAwareSigner signer = new ExpiryAwareSigner(
                new SchemeRoutingSigner(Map.of("https", passThrough)), Duration.ofHours(1));
        CutoutLinkProvider cutout = new CutoutLinkProvider(new ConfiguredCutoutLocator(CUTOUT, Map.of()));
        assembler = new LinkAssembler(storage, signer, List.of(cutout));
    }

    @Test
    void image_yieldsThisThenCutout() {
        Identifier id = resolver.parse("img:123");
        when(storage.locate(id)).thenReturn(new ObjectReference(
                URI.create("https://storage.example.org/img/123.fits?sig=abc"),
                2048L,
                "calexp",
                null,
                NOW.plusSeconds(300)));

        AssembledLinks links = assembler.assemble(id, EnumSet.of(Capability.CUTOUT));

        assertEquals(2, links.entries().size());
        LinkEntry self = links.entries().get(0);
        assertEquals(Semantics.THIS, self.semantics());
        assertEquals("https://storage.example.org/img/123.fits?sig=abc", self.accessUrl());
        assertEquals("application/fits", self.contentType());
        assertEquals(2048L, self.contentLength());

        LinkEntry cutout = links.entries().get(1);
        assertEquals(Semantics.CUTOUT, cutout.semantics());
        assertEquals(CutoutLinkProvider.DESCRIPTOR_ID, cutout.serviceDef());
        assertEquals(1, links.descriptors().size());
        assertEquals(CUTOUT.toString(), links.descriptors().get(0).accessUrl());

        assertEquals(NOW.plusSeconds(300), links.window().minExpiry());
        links.entries().forEach(e -> assertEquals("img:123", e.id()));
    }

    @Test
    void notFound_keepsCutoutRow() {
        Identifier id = resolver.parse("img:404");
        when(storage.locate(id)).thenThrow(new NotFoundException("img:404 is not in the registry"));

        AssembledLinks links = assembler.assemble(id, EnumSet.of(Capability.CUTOUT));

        assertEquals(2, links.entries().size());
        LinkEntry self = links.entries().get(0);
        assertTrue(self.isError());
        assertTrue(self.errorMessage().startsWith("NotFoundFault: "), self.errorMessage());
        assertNull(self.accessUrl());
        assertEquals(Semantics.CUTOUT, links.entries().get(1).semantics());
        assertFalse(links.window().isSet());
    }

    @Test
    void lookupFailure_isTransientFault() {
        Identifier id = resolver.parse("img:500");
        when(storage.locate(any())).thenThrow(new StorageLookupException("registry timed out"));

        AssembledLinks links = assembler.assemble(id, Set.of());

        assertEquals(1, links.entries().size());
        assertEquals("TransientFault: registry timed out", links.entries().get(0).errorMessage());
    }

    @Test
    void unsupportedScheme_isFatalFault() {
        Identifier id = resolver.parse("img:ftp");
        when(storage.locate(id)).thenReturn(
                new ObjectReference(URI.create("ftp://example.org/a.fits"), null, null, null, null));

        AssembledLinks links = assembler.assemble(id, Set.of());

        assertTrue(links.entries().get(0).errorMessage().startsWith("FatalFault: "));
    }

    @Test
    void lookupFailureWithoutCutoutEndpoint_usesStandardFaultNames() {
        ExpiryAwareSigner signer = new ExpiryAwareSigner(
                new SchemeRoutingSigner(Map.of("https", new PassThroughSigner(new MutableClock(NOW)))),
                Duration.ofHours(1));
        CutoutLinkProvider cutout = new CutoutLinkProvider(new ConfiguredCutoutLocator(null, Map.of()));
        LinkAssembler noEndpoints = new LinkAssembler(storage, signer, List.of(cutout));
        Identifier id = resolver.parse("butler://dp02/3a3e4c5b-12ab-4cde-9f01-23456789abcd");
        when(storage.locate(id)).thenThrow(new StorageLookupException("registry timed out"));

        AssembledLinks links = noEndpoints.assemble(id, EnumSet.of(Capability.CUTOUT));

        assertEquals(2, links.entries().size());
        assertEquals("TransientFault: registry timed out", links.entries().get(0).errorMessage());
        LinkEntry cutoutRow = links.entries().get(1);
        assertEquals(Semantics.CUTOUT, cutoutRow.semantics());
        assertEquals("NotFoundFault: No cutout service available for dp02", cutoutRow.errorMessage());
        Set<String> standard = Set.of("NotFoundFault", "UsageFault", "TransientFault", "FatalFault", "DefaultFault");
        links.entries().forEach(e -> assertTrue(
                standard.contains(e.errorMessage().substring(0, e.errorMessage().indexOf(':'))), e.errorMessage()));
    }

    @Test
    void rawDataset_hasNoCutout() {
        Identifier id = resolver.parse("butler://dp02/3a3e4c5b-12ab-4cde-9f01-23456789abcd");
        when(storage.locate(id)).thenReturn(new ObjectReference(
                URI.create("https://storage.example.org/raw.fits"), 10L, ObjectReference.RAW_DATASET_TYPE, null, null));

        AssembledLinks links = assembler.assemble(id, EnumSet.of(Capability.CUTOUT));

        assertEquals(1, links.entries().size());
        assertTrue(links.descriptors().isEmpty());
        assertEquals(NOW.plus(Duration.ofHours(1)), links.window().minExpiry());
    }

    @Test
    void catalogRow_hasNoCutout() {
        Identifier id = resolver.parse("row:dp02.Object:42");
        when(storage.locate(id)).thenReturn(new ObjectReference(
                URI.create("https://tap.example.org/row/42"), null, null, null, NOW.plusSeconds(60)));

        AssembledLinks links = assembler.assemble(id, EnumSet.of(Capability.CUTOUT));

        assertEquals(1, links.entries().size());
        assertEquals("application/x-votable+xml", links.entries().get(0).contentType());
        assertEquals("Catalog row data", links.entries().get(0).description());
    }

    @Test
    void disabledCapability_isSkipped() {
        Identifier id = resolver.parse("img:1");
        when(storage.locate(id)).thenReturn(
                new ObjectReference(URI.create("https://storage.example.org/1.fits"), null, null, null, null));

        AssembledLinks links = assembler.assemble(id, Set.of());

        assertEquals(1, links.entries().size());
        assertTrue(links.descriptors().isEmpty());
    }

    @Test
    void everyEntry_hasExactlyOneTarget() {
        for (String raw : List.of("img:1", "img:2", "row:t:3")) {
            Identifier id = resolver.parse(raw);
            if (raw.equals("img:2")) {
                when(storage.locate(id)).thenThrow(new NotFoundException("missing"));
            } else {
                when(storage.locate(id)).thenReturn(
                        new ObjectReference(URI.create("https://storage.example.org/x"), null, null, null, null));
            }
            AssembledLinks links = assembler.assemble(id, EnumSet.of(Capability.CUTOUT));
            assertEquals(Semantics.THIS, links.entries().get(0).semantics());
            links.entries().forEach(e -> assertEquals(1, e.populatedTargets(), e.toString()));
        }
    }
}

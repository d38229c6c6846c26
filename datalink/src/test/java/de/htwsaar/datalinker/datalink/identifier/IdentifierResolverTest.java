package de.htwsaar.datalinker.datalink.identifier;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class IdentifierResolverTest {

    private final IdentifierResolver resolver = new IdentifierResolver();

    @Test
    void imageToken_isImage() {
        Identifier id = resolver.parse("img:123");
        assertEquals(IdentifierKind.IMAGE, id.kind());
        assertEquals("img", id.scheme());
        assertEquals("123", id.localId());
        assertEquals("img:123", id.raw());
        assertTrue(id.deployment().isEmpty());
    }

    @Test
    void butlerIdentifier_carriesRepositoryLabel() {
        Identifier id = resolver.parse("butler://dp02/3a3e4c5b-12ab-4cde-9f01-23456789abcd");
        assertEquals(IdentifierKind.IMAGE, id.kind());
        assertEquals("dp02", id.deployment().orElseThrow());
        assertEquals("3a3e4c5b-12ab-4cde-9f01-23456789abcd", id.localId());
    }

    @Test
    void catalogRow_isCatalogRow() {
        Identifier id = resolver.parse("row:dp02_dc2_catalogs.Object:1234567890");
        assertEquals(IdentifierKind.CATALOG_ROW, id.kind());
        assertEquals("dp02_dc2_catalogs.Object", id.namespace());
        assertEquals("1234567890", id.localId());
    }

    @Test
    void otherScheme_isUnknown() {
        assertEquals(IdentifierKind.UNKNOWN, resolver.classify("ivo://example.org/thing"));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "bogus",
        "",
        "   ",
        "butler://",
        "butler://dp02",
        "butler://dp02/not-a-uuid",
        "butler://dp02/3A3E4C5B-12AB-4CDE-9F01-23456789ABCD",
        "img:",
        "img:a b",
        "row:table",
        "row:table:abc",
        "img:<script>"
    })
    void malformed_isInvalid(String raw) {
        InvalidIdentifierException ex = assertThrows(InvalidIdentifierException.class, () -> resolver.parse(raw));
        assertTrue(ex.getMessage().startsWith("Unable to extract valid dataset ID from"), ex.getMessage());
    }

    @Test
    void tooLong_isInvalid() {
        String raw = "img:" + "a".repeat(IdentifierResolver.MAX_LENGTH);
        assertThrows(InvalidIdentifierException.class, () -> resolver.parse(raw));
    }

    @Test
    void require_rejectsUnknownKind() {
        InvalidIdentifierException ex = assertThrows(
                InvalidIdentifierException.class,
                () -> resolver.require("ivo://example.org/thing", IdentifierResolver.linkableKinds()));
        assertEquals("ivo://example.org/thing", ex.getIdentifier());
    }

    @Test
    void require_acceptsListedKind() {
        Identifier id = resolver.require("img:42", Set.of(IdentifierKind.IMAGE));
        assertEquals(IdentifierKind.IMAGE, id.kind());
    }

    @Test
    void classify_isPure() {
        assertEquals(resolver.classify("img:7"), resolver.classify("img:7"));
    }
}

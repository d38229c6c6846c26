package de.htwsaar.datalinker.common.util;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class DigestUtilTest {

    @Test
    void sha256Hex_matchesKnownVector() {
        assertEquals(
                "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
                DigestUtil.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void hmacSha256Hex_matchesRfc4231Vector() {
        // RFC 4231, Testfall 2
        assertEquals(
                "5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843",
                DigestUtil.hmacSha256Hex("Jefe", "what do ya want for nothing?"));
    }

    @Test
    void hmacSha256Hex_rejectsEmptyKey() {
        assertThrows(IllegalArgumentException.class, () -> DigestUtil.hmacSha256Hex("", "x"));
        assertThrows(IllegalArgumentException.class, () -> DigestUtil.hmacSha256Hex(null, "x"));
    }

    @Test
    void constantTimeEquals_handlesNullAndMismatch() {
        assertTrue(DigestUtil.constantTimeEquals("abc", "abc"));
        assertFalse(DigestUtil.constantTimeEquals("abc", "abd"));
        assertFalse(DigestUtil.constantTimeEquals(null, "abc"));
    }
}

package de.htwsaar.datalinker.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Hash- und MAC-Hilfsfunktionen für signierte URLs.
 */
public final class DigestUtil {

    private static final String HMAC_SHA256 = "HmacSHA256";

    private DigestUtil() {}

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return toHex(md.digest(data));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute SHA-256", e);
        }
    }

    /**
     * Berechnet einen HMAC-SHA256 über den UTF-8-kodierten Text.
     *
     * @param key     geheimer Schlüssel (nicht leer)
     * @param message zu signierender Text
     * @return Signatur als Hex-String (Kleinbuchstaben)
     */
    public static String hmacSha256Hex(String key, String message) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("HMAC key must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return toHex(mac.doFinal(message.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Unable to compute HMAC-SHA256", e);
        }
    }

    /**
     * Vergleicht zwei Signaturen in konstanter Zeit.
     *
     * @param expected erwartete Signatur
     * @param actual   gelieferte Signatur
     * @return {@code true} bei Übereinstimmung
     */
    public static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) return false;
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), actual.getBytes(StandardCharsets.UTF_8));
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(String.format("%02x", b));
        }
        return sb.toString();
    }
}

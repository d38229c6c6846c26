package de.htwsaar.datalinker.datalink.signing;

import de.htwsaar.datalinker.common.util.DigestUtil;
import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.SignedUrl;
import de.htwsaar.datalinker.datalink.domain.SigningException;
import de.htwsaar.datalinker.datalink.domain.UrlSigner;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Signiert Objekt-Storage-Referenzen ({@code s3://bucket/key}, {@code gs://bucket/key}) für ein
 * Download-Gateway mit HMAC-SHA256.
 *
 * <p>Ergebnis: {@code <gateway>/<bucket>/<key>?X-Expires=<epochSec>&X-Signature=<hex>}; signiert wird
 * {@code GET\n/<bucket>/<key>\n<epochSec>}.</p>
 */
public class GatewayHmacSigner implements UrlSigner {

    public static final String EXPIRES_PARAM = "X-Expires";
    public static final String SIGNATURE_PARAM = "X-Signature";

    private final URI gatewayBaseUri;
    private final String signingKey;
    private final Clock clock;

    public GatewayHmacSigner(URI gatewayBaseUri, String signingKey, Clock clock) {
        this.gatewayBaseUri = Objects.requireNonNull(gatewayBaseUri, "gatewayBaseUri must not be null");
        this.signingKey = Objects.requireNonNull(signingKey, "signingKey must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (signingKey.isBlank()) {
            throw new IllegalArgumentException("signingKey must not be blank");
        }
    }

    @Override
    public SignedUrl sign(ObjectReference reference, Duration ttl) {
        URI uri = reference.uri();
        // getHost() ist null für Bucket-Namen mit Unterstrich
        String bucket = uri.getAuthority();
        String key = uri.getPath() == null ? "" : uri.getPath().replaceFirst("^/+", "");
        if (bucket == null || bucket.isBlank() || key.isBlank()) {
            throw new SigningException("Object URI " + uri + " has no bucket or key");
        }

        Instant expiresAt = clock.instant().plus(ttl);
        long expiresEpoch = expiresAt.getEpochSecond();
        String path = "/" + bucket + "/" + key;
        String signature = DigestUtil.hmacSha256Hex(signingKey, canonicalRequest(path, expiresEpoch));

        String url = UriComponentsBuilder.fromUri(gatewayBaseUri)
                .path(UriUtils.encodePath(path, "UTF-8"))
                .queryParam(EXPIRES_PARAM, expiresEpoch)
                .queryParam(SIGNATURE_PARAM, signature)
                .build(true)
                .toUriString();
        // Sekundengenau, passend zu X-Expires
        return new SignedUrl(url, Instant.ofEpochSecond(expiresEpoch));
    }

    private static String canonicalRequest(String path, long expiresEpoch) {
        return "GET\n" + path + "\n" + expiresEpoch;
    }
}

package de.htwsaar.datalinker.datalink.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Signierte (oder frei zugängliche) URL samt optionalem Ablaufzeitpunkt.
 *
 * @param url       vollständige URL
 * @param expiresAt Ablauf, {@code null} wenn die URL nicht abläuft
 */
public record SignedUrl(String url, Instant expiresAt) {

    public SignedUrl {
        Objects.requireNonNull(url, "url must not be null");
    }

    public Optional<Instant> expiry() {
        return Optional.ofNullable(expiresAt);
    }
}

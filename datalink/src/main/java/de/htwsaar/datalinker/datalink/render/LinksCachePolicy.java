package de.htwsaar.datalinker.datalink.render;

import de.htwsaar.datalinker.datalink.signing.ExpiryWindow;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Leitet die Cache-Dauer einer Antwort aus dem Ablauf-Fenster ab.
 *
 * <p>Fenster gesetzt: {@code minExpiry - now}, nach unten bei 0 gekappt (sekundengenau abgerundet).
 * Fenster leer: statische Vorgabe.</p>
 */
public class LinksCachePolicy {

    private final Clock clock;
    private final Duration staticMaxAge;

    public LinksCachePolicy(Clock clock, Duration staticMaxAge) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.staticMaxAge = Objects.requireNonNull(staticMaxAge, "staticMaxAge must not be null");
        if (staticMaxAge.isNegative()) {
            throw new IllegalArgumentException("staticMaxAge must not be negative");
        }
    }

    public Duration maxAge(ExpiryWindow window) {
        if (!window.isSet()) {
            return staticMaxAge;
        }
        Instant now = clock.instant();
        Duration remaining = Duration.between(now, window.minExpiry());
        if (remaining.isNegative()) {
            return Duration.ZERO;
        }
        return Duration.ofSeconds(remaining.getSeconds());
    }
}

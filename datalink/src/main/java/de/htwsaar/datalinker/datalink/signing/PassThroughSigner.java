package de.htwsaar.datalinker.datalink.signing;

import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.SignedUrl;
import de.htwsaar.datalinker.datalink.domain.UrlSigner;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Für {@code http(s)}-Referenzen, die die Registry bereits signiert ausliefert.
 * Ablauf: von der Registry gemeldet, sonst {@code now + ttl}.
 */
public class PassThroughSigner implements UrlSigner {

    private final Clock clock;

    public PassThroughSigner(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public SignedUrl sign(ObjectReference reference, Duration ttl) {
        if (reference.expiresAt() != null) {
            return new SignedUrl(reference.uri().toString(), reference.expiresAt());
        }
        return new SignedUrl(reference.uri().toString(), clock.instant().plus(ttl));
    }
}

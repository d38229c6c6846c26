package de.htwsaar.datalinker.datalink.signing;

import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.SignedUrl;
import de.htwsaar.datalinker.datalink.domain.UrlSigner;
import java.time.Duration;
import java.util.Objects;

/**
 * Dünne Hülle um den {@link UrlSigner}: reicht Ablaufzeitpunkte an den Aufrufer zurück.
 *
 * <p>Pro Zusammenstellung einer Antwort wird eine eigene {@link Session} geöffnet; Sessions werden
 * nicht zwischen Requests geteilt und brauchen daher keine Synchronisation.</p>
 */
public class ExpiryAwareSigner {

    private final UrlSigner delegate;
    private final Duration ttl;

    /**
     * @param delegate eigentlicher Signierer
     * @param ttl      gewünschte Gültigkeit signierter URLs
     */
    public ExpiryAwareSigner(UrlSigner delegate, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.ttl = Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }

    public Session openSession() {
        return new Session();
    }

    /** Sammelt das Ablauf-Minimum über alle Signaturen einer Antwort. */
    public final class Session {

        private ExpiryWindow window = ExpiryWindow.unset();

        private Session() {}

        /**
         * @param reference zu signierendes Objekt
         * @return signierte URL
         * @throws de.htwsaar.datalinker.datalink.domain.SigningException wenn der Delegate scheitert
         */
        public SignedUrl sign(ObjectReference reference) {
            SignedUrl signed = delegate.sign(reference, ttl);
            window = window.include(signed.expiresAt());
            return signed;
        }

        public ExpiryWindow window() {
            return window;
        }
    }
}

package de.htwsaar.datalinker.datalink.signing;

import de.htwsaar.datalinker.datalink.domain.ObjectReference;
import de.htwsaar.datalinker.datalink.domain.SignedUrl;
import de.htwsaar.datalinker.datalink.domain.SigningException;
import de.htwsaar.datalinker.datalink.domain.UrlSigner;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Wählt den Signierer anhand des URI-Schemas der Referenz.
 */
public class SchemeRoutingSigner implements UrlSigner {

    private final Map<String, UrlSigner> signersByScheme;

    /**
     * @param signersByScheme Schema (Kleinbuchstaben) → Signierer
     */
    public SchemeRoutingSigner(Map<String, UrlSigner> signersByScheme) {
        this.signersByScheme = Map.copyOf(Objects.requireNonNull(signersByScheme, "signersByScheme must not be null"));
    }

    @Override
    public SignedUrl sign(ObjectReference reference, Duration ttl) {
        UrlSigner signer = signersByScheme.get(reference.scheme());
        if (signer == null) {
            throw new SigningException("No signer configured for URI scheme '" + reference.scheme() + "'");
        }
        return signer.sign(reference, ttl);
    }
}

package de.htwsaar.datalinker.datalink.domain;

import java.time.Duration;

/**
 * Port zur Signierung von Objekt-Referenzen.
 */
public interface UrlSigner {

    /**
     * @param reference zu signierendes Objekt
     * @param ttl       gewünschte Gültigkeit
     * @return URL und Ablaufzeitpunkt
     * @throws SigningException wenn keine URL erzeugt werden kann
     */
    SignedUrl sign(ObjectReference reference, Duration ttl);
}

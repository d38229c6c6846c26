package de.htwsaar.datalinker.datalink.domain;

import java.net.URI;

/**
 * Port zur Ermittlung des synchronen SODA-Cutout-Endpunkts.
 */
public interface CutoutLocator {

    /**
     * @param deployment Deployment-Label (Repository), {@code null} für den Standard
     * @return Endpunkt-URL
     * @throws CutoutUnavailableException wenn für das Deployment kein Endpunkt existiert
     */
    URI endpointFor(String deployment);
}

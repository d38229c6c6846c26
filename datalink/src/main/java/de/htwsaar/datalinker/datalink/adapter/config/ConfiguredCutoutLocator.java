package de.htwsaar.datalinker.datalink.adapter.config;

import de.htwsaar.datalinker.datalink.domain.CutoutLocator;
import de.htwsaar.datalinker.datalink.domain.CutoutUnavailableException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cutout-Endpunkte aus der Konfiguration: optionale Overrides je Repository-Label, sonst der Standard-Endpunkt.
 */
public final class ConfiguredCutoutLocator implements CutoutLocator {

    private final URI defaultEndpoint;
    private final Map<String, URI> endpointsByDeployment;

    /**
     * @param defaultEndpoint       Standard-Endpunkt oder {@code null}
     * @param endpointsByDeployment Label → Endpunkt
     */
    public ConfiguredCutoutLocator(URI defaultEndpoint, Map<String, URI> endpointsByDeployment) {
        this.defaultEndpoint = defaultEndpoint;
        this.endpointsByDeployment = new LinkedHashMap<>(endpointsByDeployment);
    }

    /**
     * @return {@code true} wenn überhaupt ein Cutout-Endpunkt konfiguriert ist (Capability-Schalter)
     */
    public boolean isConfigured() {
        return defaultEndpoint != null || !endpointsByDeployment.isEmpty();
    }

    @Override
    public URI endpointFor(String deployment) {
        if (deployment != null) {
            URI specific = endpointsByDeployment.get(deployment);
            if (specific != null) return specific;
        }
        if (defaultEndpoint != null) return defaultEndpoint;
        throw new CutoutUnavailableException(
                "No cutout service available for " + (deployment == null ? "default deployment" : deployment));
    }
}

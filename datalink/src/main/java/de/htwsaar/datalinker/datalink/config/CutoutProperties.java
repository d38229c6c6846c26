package de.htwsaar.datalinker.datalink.config;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cutout-Konfiguration unter {@code datalinker.cutout}.
 *
 * @param syncUrl   Standard-SODA-sync-Endpunkt; leer schaltet Cutouts ab
 * @param endpoints Repository-Label → eigener Endpunkt
 */
@ConfigurationProperties(prefix = "datalinker.cutout")
public record CutoutProperties(String syncUrl, Map<String, String> endpoints) {

    public CutoutProperties {
        endpoints = endpoints == null ? Map.of() : new LinkedHashMap<>(endpoints);
    }
}

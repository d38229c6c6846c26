package de.htwsaar.datalinker.datalink.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * HiPS-Konfiguration unter {@code datalinker.hips}.
 *
 * @param defaultDataset Datensatz der v1-Liste
 * @param datasets       Datensatzname → Server und Pfade
 * @param token          Bearer-Token für die properties-Abrufe
 * @param ttl            Frische-Fenster einer Liste
 */
@ConfigurationProperties(prefix = "datalinker.hips")
public record HipsProperties(String defaultDataset, Map<String, Dataset> datasets, String token, Duration ttl) {

    public HipsProperties {
        datasets = datasets == null ? Map.of() : new LinkedHashMap<>(datasets);
        ttl = ttl == null ? Duration.ofMinutes(10) : ttl;
    }

    /**
     * @param url   Basis-URL der HiPS-Bäume
     * @param paths Pfade relativ zu {@code url}
     */
    public record Dataset(String url, List<String> paths) {

        public Dataset {
            paths = paths == null ? List.of() : List.copyOf(paths);
        }
    }
}

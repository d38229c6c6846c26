package de.htwsaar.datalinker.datalink.hips;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Hält je konfiguriertem HiPS-Datensatz (z. B. {@code dp02}, {@code dp1}) einen eigenen {@link CollectionListCache}.
 */
public class HipsListRegistry {

    private final Map<String, CollectionListCache> caches;
    private final String defaultDataset;

    /**
     * @param caches         Datensatzname → Cache, Reihenfolge wie konfiguriert
     * @param defaultDataset Datensatz der v1-Liste, {@code null} wenn keiner konfiguriert ist
     */
    public HipsListRegistry(Map<String, CollectionListCache> caches, String defaultDataset) {
        this.caches = new LinkedHashMap<>(caches);
        this.defaultDataset = defaultDataset == null || defaultDataset.isBlank() ? null : defaultDataset.trim();
    }

    /**
     * @param dataset Datensatzname
     * @return zugehöriger Cache
     * @throws UnknownDatasetException wenn nicht konfiguriert
     */
    public CollectionListCache cacheFor(String dataset) {
        if (caches.isEmpty()) {
            throw new UnknownDatasetException("No HiPS datasets are configured");
        }
        CollectionListCache cache = caches.get(dataset);
        if (cache == null) {
            throw new UnknownDatasetException(dataset, datasetNames());
        }
        return cache;
    }

    /**
     * Cache der v1-Liste. Leer, wenn kein Standard-Datensatz konfiguriert ist oder dieser nicht existiert.
     */
    public Optional<CollectionListCache> defaultCache() {
        return defaultDataset == null ? Optional.empty() : Optional.ofNullable(caches.get(defaultDataset));
    }

    public List<String> datasetNames() {
        return new ArrayList<>(caches.keySet());
    }

    public Collection<CollectionListCache> all() {
        return caches.values();
    }

    /**
     * Refresht alle Listen nacheinander.
     *
     * @return Anzahl tatsächlich ausgeführter Refreshs
     */
    public int refreshAll() {
        int ran = 0;
        for (CollectionListCache cache : caches.values()) {
            if (cache.refresh()) ran++;
        }
        return ran;
    }
}

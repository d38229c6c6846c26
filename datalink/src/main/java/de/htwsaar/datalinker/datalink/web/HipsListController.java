package de.htwsaar.datalinker.datalink.web;

import de.htwsaar.datalinker.common.util.DigestUtil;
import de.htwsaar.datalinker.datalink.hips.CollectionListCache;
import de.htwsaar.datalinker.datalink.hips.CollectionListEntry;
import de.htwsaar.datalinker.datalink.hips.CollectionListSnapshot;
import de.htwsaar.datalinker.datalink.hips.CollectionListUnavailableException;
import de.htwsaar.datalinker.datalink.hips.HipsListRegistry;
import de.htwsaar.datalinker.datalink.hips.HipsPropertiesFormat;
import de.htwsaar.datalinker.datalink.hips.UnknownDatasetException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HiPS-Listen aus dem Cache.
 *
 * <ul>
 *   <li>GET /api/hips/list – Liste des Standard-Datensatzes</li>
 *   <li>GET /api/hips/v2/{dataset}/list – Liste je Datensatz</li>
 *   <li>GET /api/hips/v2/{dataset}/collections – Properties je Collection als JSON</li>
 *   <li>GET /api/hips/status – Zustand aller Caches</li>
 *   <li>POST /api/hips/admin/refresh – erzwingt einen Refresh (Admin-Token)</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/hips")
public class HipsListController {

    private final HipsListRegistry registry;

    public HipsListController(HipsListRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/list")
    public ResponseEntity<String> defaultList() {
        Optional<CollectionListCache> cache = registry.defaultCache();
        if (cache.isEmpty()) {
            return textOk("");
        }
        return list(cache.get());
    }

    @GetMapping("/v2/{dataset}/list")
    public ResponseEntity<String> datasetList(@PathVariable("dataset") String dataset) {
        try {
            return list(registry.cacheFor(dataset));
        } catch (UnknownDatasetException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(ex.getMessage());
        }
    }

    @GetMapping("/v2/{dataset}/collections")
    public ResponseEntity<?> collections(@PathVariable("dataset") String dataset) {
        try {
            CollectionListSnapshot snapshot = registry.cacheFor(dataset).read();
            Map<String, Map<String, String>> body = new LinkedHashMap<>();
            for (CollectionListEntry entry : snapshot.entries().values()) {
                body.put(entry.key(), entry.properties());
            }
            return ResponseEntity.ok(body);
        } catch (UnknownDatasetException ex) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
        } catch (CollectionListUnavailableException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", ex.getMessage()));
        }
    }

    /**
     * @return je Datensatz Zustand, letzter Refresh, Health und Anzahl Einträge
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        for (CollectionListCache cache : registry.all()) {
            CollectionListSnapshot snapshot = cache.snapshot();
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("state", cache.state().name());
            entry.put("lastSuccess", snapshot.lastSuccess() == null ? null : snapshot.lastSuccess().toString());
            entry.put("healthy", snapshot.healthy());
            entry.put("entries", snapshot.entries().size());
            entry.put("lastError", snapshot.lastError());
            body.put(cache.name(), entry);
        }
        return ResponseEntity.ok(body);
    }

    @PostMapping("/admin/refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        int ran = registry.refreshAll();
        List<String> datasets = registry.datasetNames();
        return ResponseEntity.ok(Map.of("datasets", datasets, "refreshed", ran));
    }

    private static ResponseEntity<String> list(CollectionListCache cache) {
        try {
            CollectionListSnapshot snapshot = cache.read();
            String body = HipsPropertiesFormat.formatList(snapshot.entries().values());
            return ResponseEntity.ok()
                    .contentType(MediaType.TEXT_PLAIN)
                    .eTag(DigestUtil.sha256Hex(body.getBytes(StandardCharsets.UTF_8)))
                    .body(body);
        } catch (CollectionListUnavailableException ex) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .contentType(MediaType.TEXT_PLAIN)
                    .body(ex.getMessage());
        }
    }

    private static ResponseEntity<String> textOk(String body) {
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(body);
    }
}

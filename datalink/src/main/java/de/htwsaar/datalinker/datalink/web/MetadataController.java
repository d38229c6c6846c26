package de.htwsaar.datalinker.datalink.web;

import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Metadaten: intern unter {@code /}, extern unter {@code /api/datalink/} (in {@code metadata} verpackt).
 */
@RestController
public class MetadataController {

    private final ServiceMetadata metadata;

    public MetadataController(ServiceMetadata metadata) {
        this.metadata = metadata;
    }

    @GetMapping("/")
    public ResponseEntity<ServiceMetadata> internal() {
        return ResponseEntity.ok(metadata);
    }

    @GetMapping({"/api/datalink", "/api/datalink/"})
    public ResponseEntity<Map<String, ServiceMetadata>> external() {
        return ResponseEntity.ok(Map.of("metadata", metadata));
    }
}

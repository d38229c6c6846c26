package de.htwsaar.datalinker.datalink.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health-Probe für Kubernetes.
 */
@RestController
@RequestMapping("/api/datalink")
public class DatalinkProbeController {

    /** @return HTTP 200 "ok" */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("ok");
    }
}

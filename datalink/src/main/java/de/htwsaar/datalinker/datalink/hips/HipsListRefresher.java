package de.htwsaar.datalinker.datalink.hips;

import java.util.Objects;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Hält die HiPS-Listen warm: erster Lauf direkt beim Start, danach periodisch.
 */
public class HipsListRefresher {

    private final HipsListRegistry registry;

    public HipsListRefresher(HipsListRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Scheduled(fixedDelayString = "${datalinker.hips.refresh-interval-ms:300000}")
    public void refreshAll() {
        registry.refreshAll();
    }
}

package com.docvault.maintenance;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@EnableScheduling
@ConditionalOnProperty(name = "docvault.maintenance.enabled", havingValue = "true", matchIfMissing = true)
public class MaintenanceScheduler {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);
    private static final Duration SWEEP_TIMEOUT = Duration.ofMinutes(5);

    private final MaintenanceService maintenance;

    public MaintenanceScheduler(MaintenanceService maintenance) {
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${docvault.maintenance.interval:PT1H}", initialDelayString = "${docvault.maintenance.interval:PT1H}")
    public void runSweep() {
        try {
            maintenance.sweep().block(SWEEP_TIMEOUT);
        } catch (RuntimeException e) {
            log.warn("Maintenance sweep failed: {}", e.getMessage(), e);
        }
    }
}

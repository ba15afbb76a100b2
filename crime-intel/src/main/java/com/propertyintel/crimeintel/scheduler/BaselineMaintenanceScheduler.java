package com.propertyintel.crimeintel.scheduler;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.output.ClickHouseWriter;
import com.propertyintel.crimeintel.service.anomaly.AnomalyDetector;
import com.propertyintel.crimeintel.service.baseline.EventHistory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Startup initialisation and periodic baseline upkeep.
 *
 * Default schedule: every hour at minute 15. Override with the
 * crime-intel.history.eviction-cron property.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BaselineMaintenanceScheduler {

    private final ClickHouseWriter clickHouseWriter;
    private final AnomalyDetector detector;
    private final EventHistory history;
    private final CrimeIntelProperties properties;

    /**
     * On application startup:
     *  1. Ensure the database schema exists unless output is CSV-only
     *  2. Install the cold-start priors every detector scores against
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getOutput().getMode() != CrimeIntelProperties.Output.OutputMode.CSV) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        detector.seedPriors();
        log.info("Baseline priors seeded. History maintenance schedule: {}",
                properties.getHistory().getEvictionCron());
    }

    @Scheduled(cron = "${crime-intel.history.eviction-cron:0 15 * * * ?}", zone = "UTC")
    public void maintainHistory() {
        try {
            int evicted = history.evictExpired();
            detector.recalculateBaselines();
            log.info("History maintenance done: {} evicted, {} events retained", evicted, history.size());
        } catch (Exception e) {
            log.error("History maintenance failed: {}", e.getMessage(), e);
        }
    }
}

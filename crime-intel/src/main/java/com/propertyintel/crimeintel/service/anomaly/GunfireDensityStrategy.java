package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.BaselineMetric;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.GeoLocation;
import com.propertyintel.crimeintel.service.baseline.BaselineTracker;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores acoustic gunfire detections per 0.01° grid cell against the grid
 * density baseline.
 */
@Component
@Order(2)
public class GunfireDensityStrategy implements DetectionStrategy {

    static final String BASELINE_KEY = "gunfire_grid_density";

    private static final int MAX_RELATED = 10;
    private static final double HIGH_CONFIDENCE = 0.9;
    private static final double CONFIDENCE = 0.75;

    private final CrimeIntelProperties.Anomaly config;
    private final BaselineTracker baselines;

    public GunfireDensityStrategy(CrimeIntelProperties properties, BaselineTracker baselines) {
        this.config = properties.getAnomaly();
        this.baselines = baselines;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.GUNFIRE_DENSITY;
    }

    @Override
    public void seedPriors() {
        baselines.seed(BASELINE_KEY, config.getGunfireBaselineMean(), config.getGunfireBaselineStdDev());
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        Map<GridCell, List<EventRecord>> cells = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (isGunfire(event) && event.hasCoordinates()) {
                cells.computeIfAbsent(GridCell.of(event.getLatitude(), event.getLongitude()),
                        k -> new ArrayList<>()).add(event);
            }
        }
        if (cells.isEmpty()) return List.of();

        BaselineMetric baseline = baselines.seed(BASELINE_KEY,
                config.getGunfireBaselineMean(), config.getGunfireBaselineStdDev());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<GridCell, List<EventRecord>> entry : cells.entrySet()) {
            int count = entry.getValue().size();
            double z = baseline.zScore(count);
            if (Math.abs(z) <= config.getDeviationThreshold()) continue;

            GridCell cell = entry.getKey();
            anomalies.add(AnomalyRecords.start(AnomalyType.GUNFIRE_DENSITY)
                    .severity(AnomalyRecords.cap(Math.abs(z) / 5.0))
                    .description(String.format(Locale.ROOT,
                            "Unusual gunfire density detected: %d events in grid area (Z-score: %.2f)", count, z))
                    .location(new GeoLocation(cell.lat().doubleValue(), cell.lon().doubleValue()))
                    .relatedEntities(entry.getValue().stream()
                            .limit(MAX_RELATED)
                            .map(e -> e.getEventId() == null ? "" : e.getEventId())
                            .toList())
                    .metrics(AnomalyRecords.metrics("event_count", count, "z_score", z))
                    .baseline(AnomalyRecords.baseline(baseline))
                    .deviation(z)
                    .confidence(Math.abs(z) > config.getHighDeviationThreshold() ? HIGH_CONFIDENCE : CONFIDENCE)
                    .build());
        }
        return anomalies;
    }

    static boolean isGunfire(EventRecord event) {
        return "shotspotter".equals(event.getSource()) || "gunfire".equals(event.getEventType());
    }

    /**
     * A 0.01° x 0.01° cell, keyed by coordinates rounded half-even from their
     * exact binary value.
     */
    record GridCell(BigDecimal lat, BigDecimal lon) {
        static GridCell of(double latitude, double longitude) {
            return new GridCell(round(latitude), round(longitude));
        }

        private static BigDecimal round(double value) {
            return new BigDecimal(value).setScale(2, RoundingMode.HALF_EVEN);
        }
    }
}

package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.BaselineMetric;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.service.baseline.BaselineTracker;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares event volume per hour of day with the expected diurnal curve.
 *
 * Hours are read in the offset each event was reported in, so a feed in local
 * time is bucketed by local hour.
 */
@Component
@Order(4)
public class TimelineDeviationStrategy implements DetectionStrategy {

    static final String BASELINE_KEY = "hourly_event_distribution";

    private static final double CONFIDENCE = 0.8;

    private final CrimeIntelProperties.Anomaly config;
    private final BaselineTracker baselines;

    public TimelineDeviationStrategy(CrimeIntelProperties properties, BaselineTracker baselines) {
        this.config = properties.getAnomaly();
        this.baselines = baselines;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.TIMELINE_DEVIATION;
    }

    @Override
    public void seedPriors() {
        prior();
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        Map<Integer, Integer> hourlyCounts = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (event.hasTimestamp()) {
                hourlyCounts.merge(event.getTimestamp().getHour(), 1, Integer::sum);
            }
        }
        if (hourlyCounts.isEmpty()) return List.of();

        BaselineMetric baseline = prior();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : hourlyCounts.entrySet()) {
            int hour = entry.getKey();
            int count = entry.getValue();
            double z = baseline.zScore(count);
            if (Math.abs(z) <= config.getDeviationThreshold()) continue;

            anomalies.add(AnomalyRecords.start(AnomalyType.TIMELINE_DEVIATION)
                    .severity(AnomalyRecords.cap(Math.abs(z) / 5.0))
                    .description(String.format(Locale.ROOT,
                            "Unusual event volume at hour %02d:00 - %d events (Z-score: %.2f)", hour, count, z))
                    .metrics(AnomalyRecords.metrics("hour", hour, "count", count, "z_score", z))
                    .baseline(AnomalyRecords.baseline(baseline))
                    .deviation(z)
                    .confidence(CONFIDENCE)
                    .build());
        }
        return anomalies;
    }

    private BaselineMetric prior() {
        double mean = config.getExpectedHourlyCounts().stream()
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);
        return baselines.seed(BASELINE_KEY, mean, config.getHourlyBaselineStdDev());
    }
}

package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares the mix of incident categories in a batch with the expected share
 * of each category.
 */
@Component
@Order(5)
public class CrimeSignatureShiftStrategy implements DetectionStrategy {

    private static final double CONFIDENCE = 0.7;

    private final CrimeIntelProperties.Anomaly config;

    public CrimeSignatureShiftStrategy(CrimeIntelProperties properties) {
        this.config = properties.getAnomaly();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.CRIME_SIGNATURE_SHIFT;
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        Map<String, Integer> typeCounts = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (isIncident(event)) {
                String category = event.getIncidentType() != null ? event.getIncidentType() : "unknown";
                typeCounts.merge(category, 1, Integer::sum);
            }
        }

        int total = typeCounts.values().stream().mapToInt(Integer::intValue).sum();
        if (total == 0) return List.of();

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : typeCounts.entrySet()) {
            String crimeType = entry.getKey();
            int count = entry.getValue();
            double observed = (double) count / total;
            double expected = expectedShare(crimeType);
            if (expected <= 0) continue;

            double ratio = observed / expected;
            if (ratio <= config.getSignatureUpperRatio() && ratio >= config.getSignatureLowerRatio()) continue;

            anomalies.add(AnomalyRecords.start(AnomalyType.CRIME_SIGNATURE_SHIFT)
                    .severity(AnomalyRecords.cap(Math.abs(ratio - 1.0) / 2.0))
                    .description(String.format(Locale.ROOT,
                            "Crime signature shift detected: %s at %.1f%% (expected %.1f%%)",
                            crimeType, observed * 100, expected * 100))
                    .metrics(AnomalyRecords.metrics(
                            "crime_type", crimeType,
                            "observed_rate", observed,
                            "expected_rate", expected,
                            "ratio", ratio,
                            "count", count))
                    .deviation(ratio - 1.0)
                    .confidence(CONFIDENCE)
                    .build());
        }
        return anomalies;
    }

    private double expectedShare(String crimeType) {
        Double share = config.getExpectedCrimeShares().get(crimeType.toLowerCase(Locale.ROOT));
        return share != null ? share : config.getDefaultCrimeShare();
    }

    static boolean isIncident(EventRecord event) {
        return "incident".equals(event.getEventType()) || "incident".equals(event.getType());
    }
}

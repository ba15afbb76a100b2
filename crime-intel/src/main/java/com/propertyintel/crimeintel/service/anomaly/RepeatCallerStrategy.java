package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Flags callers placing calls for service at an unusually high rate.
 */
@Component
@Order(6)
public class RepeatCallerStrategy implements DetectionStrategy {

    private static final double CONFIDENCE = 0.85;

    private final CrimeIntelProperties.Anomaly config;

    public RepeatCallerStrategy(CrimeIntelProperties properties) {
        this.config = properties.getAnomaly();
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.REPEAT_CALLER;
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        Map<String, List<EventRecord>> callsByCaller = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (isCadCall(event) && event.getCallerId() != null) {
                callsByCaller.computeIfAbsent(event.getCallerId(), k -> new ArrayList<>()).add(event);
            }
        }

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (Map.Entry<String, List<EventRecord>> entry : callsByCaller.entrySet()) {
            List<EventRecord> calls = entry.getValue();
            if (calls.size() < config.getRepeatCallerMinCalls()) continue;

            List<OffsetDateTime> times = calls.stream()
                    .map(EventRecord::getTimestamp)
                    .filter(Objects::nonNull)
                    .sorted(Comparator.comparing(OffsetDateTime::toInstant))
                    .toList();
            if (times.size() < 2) continue;

            double spanHours = Duration.between(times.get(0), times.get(times.size() - 1)).toMillis() / 3_600_000.0;
            if (spanHours <= 0) continue;

            double callsPerHour = calls.size() / spanHours;
            if (callsPerHour <= config.getRepeatCallerRateThreshold()) continue;

            anomalies.add(AnomalyRecords.start(AnomalyType.REPEAT_CALLER)
                    .severity(AnomalyRecords.cap(callsPerHour / 5.0))
                    .description(String.format(Locale.ROOT,
                            "Repeat caller anomaly: %d calls in %.1f hours", calls.size(), spanHours))
                    .relatedEntity(entry.getKey())
                    .metrics(AnomalyRecords.metrics(
                            "call_count", calls.size(),
                            "time_span_hours", spanHours,
                            "calls_per_hour", callsPerHour))
                    .confidence(CONFIDENCE)
                    .build());
        }
        return anomalies;
    }

    static boolean isCadCall(EventRecord event) {
        return "cad_call".equals(event.getEventType()) || "cad".equals(event.getSource());
    }
}

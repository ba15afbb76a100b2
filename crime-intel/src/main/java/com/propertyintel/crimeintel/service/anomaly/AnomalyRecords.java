package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.BaselineMetric;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Builder shortcuts shared by the detection strategies.
 */
final class AnomalyRecords {

    private AnomalyRecords() {}

    static AnomalyRecord.AnomalyRecordBuilder start(AnomalyType type) {
        return AnomalyRecord.builder()
                .anomalyId(UUID.randomUUID().toString())
                .anomalyType(type)
                .detectedAt(Instant.now());
    }

    /** Ordered, read-only metrics map from alternating keys and values. */
    static Map<String, Object> metrics(Object... keysAndValues) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            metrics.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(metrics);
    }

    static Map<String, Double> baseline(BaselineMetric metric) {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        snapshot.put("mean", metric.getMean());
        snapshot.put("std_dev", metric.getStdDev());
        return Collections.unmodifiableMap(snapshot);
    }

    static double cap(double value) {
        return Math.min(1.0, value);
    }
}

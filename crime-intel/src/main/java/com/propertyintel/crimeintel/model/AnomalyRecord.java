package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One detected anomaly. Records are never updated; re-run detection to get
 * a fresh view.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AnomalyRecord {

    String anomalyId;
    AnomalyType anomalyType;

    /** 0.0 - 1.0 */
    double severity;

    String description;

    /** Null when the anomaly has no single place, e.g. an hour-of-day spike */
    GeoLocation location;

    @Singular
    List<String> relatedEntities;

    /** Detector-specific figures, in insertion order */
    Map<String, Object> metrics;

    /** mean / std_dev the value was scored against, when there was one */
    Map<String, Double> baseline;

    /** Signed distance from normal; a Z-score where one applies */
    double deviation;

    /** 0.0 - 1.0 */
    double confidence;

    Instant detectedAt;
}

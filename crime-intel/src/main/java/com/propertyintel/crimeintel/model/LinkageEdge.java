package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A typed, confidence-scored assertion that two incidents are related.
 *
 * Edges are directed as produced but mean the same thing both ways; no
 * reverse edge is implied.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LinkageEdge {

    String sourceIncidentId;
    String targetIncidentId;
    LinkageType linkageType;

    /** 0.0 - 1.0 */
    double confidence;

    String explanation;

    /** Evidence details, e.g. distance_km, shared_count, caliber */
    Map<String, Object> metadata;

    /** Deduplication key: one surviving edge per (source, target, type). */
    public Key key() {
        return new Key(sourceIncidentId, targetIncidentId, linkageType);
    }

    public record Key(String source, String target, LinkageType type) {}
}

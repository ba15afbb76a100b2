package com.propertyintel.crimeintel.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A density-connected group of points found by the spatial clusterer.
 */
@Value
@Builder
public class SpatialCluster<T> {

    String clusterId;
    double centerLat;
    double centerLon;

    /** Largest member distance from the centroid */
    double radiusMeters;

    int pointCount;

    /** Members per square kilometre */
    double density;

    @Singular
    List<T> members;
}

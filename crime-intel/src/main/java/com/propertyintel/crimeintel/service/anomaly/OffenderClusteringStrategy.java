package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.GeoLocation;
import com.propertyintel.crimeintel.model.GeoPoint;
import com.propertyintel.crimeintel.model.SpatialCluster;
import com.propertyintel.crimeintel.service.cluster.SpatialClusterer;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Looks for unusually tight groups of person sightings.
 */
@Component
@Order(3)
public class OffenderClusteringStrategy implements DetectionStrategy {

    private static final int MAX_RELATED = 10;
    private static final double CONFIDENCE = 0.7;

    private final CrimeIntelProperties.Anomaly config;
    private final SpatialClusterer clusterer;

    public OffenderClusteringStrategy(CrimeIntelProperties properties, SpatialClusterer clusterer) {
        this.config = properties.getAnomaly();
        this.clusterer = clusterer;
    }

    @Override
    public AnomalyType getType() {
        return AnomalyType.OFFENDER_CLUSTERING;
    }

    @Override
    public List<AnomalyRecord> detect(List<EventRecord> events) {
        List<GeoPoint<EventRecord>> points = new ArrayList<>();
        for (EventRecord event : events) {
            if (isPerson(event) && event.hasCoordinates()) {
                points.add(new GeoPoint<>(event.getLatitude(), event.getLongitude(), event));
            }
        }
        if (points.size() < config.getMinClusterPoints()) return List.of();

        List<SpatialCluster<EventRecord>> clusters = clusterer.cluster(
                points, config.getClusterEpsilonMeters(), config.getMinClusterPoints());

        List<AnomalyRecord> anomalies = new ArrayList<>();
        for (SpatialCluster<EventRecord> cluster : clusters) {
            int size = cluster.getPointCount();
            if (size < config.getOffenderClusterMinSize()) continue;

            anomalies.add(AnomalyRecords.start(AnomalyType.OFFENDER_CLUSTERING)
                    .severity(AnomalyRecords.cap(size / 10.0))
                    .description(String.format(Locale.ROOT,
                            "Unusual clustering of %d related individuals detected", size))
                    .location(new GeoLocation(cluster.getCenterLat(), cluster.getCenterLon()))
                    .relatedEntities(cluster.getMembers().stream()
                            .limit(MAX_RELATED)
                            .map(e -> e.getEntityId() == null ? "" : e.getEntityId())
                            .toList())
                    .metrics(AnomalyRecords.metrics(
                            "cluster_size", size,
                            "density", cluster.getDensity(),
                            "radius_meters", cluster.getRadiusMeters()))
                    .confidence(CONFIDENCE)
                    .build());
        }
        return anomalies;
    }

    static boolean isPerson(EventRecord event) {
        return "person".equals(event.getEntityType()) || "person".equals(event.getType());
    }
}

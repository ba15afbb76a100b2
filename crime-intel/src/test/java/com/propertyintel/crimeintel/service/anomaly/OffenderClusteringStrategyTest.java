package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.geo.GeoMath;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.AnomalyType;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.model.GeoLocation;
import com.propertyintel.crimeintel.service.cluster.SpatialClusterer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OffenderClusteringStrategyTest {

    private static final double LAT = 54.5973;
    private static final double LON = -5.9301;

    private final OffenderClusteringStrategy strategy =
            new OffenderClusteringStrategy(new CrimeIntelProperties(), new SpatialClusterer());

    private static List<EventRecord> people(int count, double radiusKm, String entityType) {
        List<EventRecord> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            GeoLocation p = GeoMath.project(LAT, LON, i * 360.0 / count, radiusKm);
            events.add(EventRecord.builder()
                    .entityId("person-" + i)
                    .entityType(entityType)
                    .latitude(p.latitude())
                    .longitude(p.longitude())
                    .build());
        }
        return events;
    }

    @Test
    void sixPeopleWithin100MetresFormOneAnomaly() {
        List<AnomalyRecord> anomalies = strategy.detect(people(6, 0.05, "person"));

        assertThat(anomalies).hasSize(1);
        AnomalyRecord anomaly = anomalies.get(0);
        assertThat(anomaly.getAnomalyType()).isEqualTo(AnomalyType.OFFENDER_CLUSTERING);
        assertThat(anomaly.getMetrics()).containsEntry("cluster_size", 6);
        assertThat(anomaly.getConfidence()).isEqualTo(0.7);
        assertThat(anomaly.getSeverity()).isCloseTo(0.6, within(1e-9));
        assertThat(anomaly.getLocation().latitude()).isCloseTo(LAT, within(1e-4));
        assertThat(anomaly.getRelatedEntities()).hasSize(6).allMatch(id -> id.startsWith("person-"));
    }

    @Test
    void clusterBelowReportingSizeIsNotAnAnomaly() {
        assertThat(strategy.detect(people(4, 0.05, "person"))).isEmpty();
    }

    @Test
    void tooFewPeopleSkipClustering() {
        assertThat(strategy.detect(people(2, 0.01, "person"))).isEmpty();
    }

    @Test
    void onlyPersonEntitiesAreClustered() {
        assertThat(strategy.detect(people(8, 0.05, "vehicle"))).isEmpty();
    }

    @Test
    void largeClusterCapsSeverityAndRelatedEntities() {
        List<AnomalyRecord> anomalies = strategy.detect(people(14, 0.1, "person"));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(1.0);
        assertThat(anomalies.get(0).getRelatedEntities()).hasSize(10);
    }
}

package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.EventRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CrimeSignatureShiftStrategyTest {

    private final CrimeSignatureShiftStrategy strategy = new CrimeSignatureShiftStrategy(new CrimeIntelProperties());

    private static void add(List<EventRecord> events, String incidentType, int count) {
        for (int i = 0; i < count; i++) {
            events.add(EventRecord.builder().eventType("incident").incidentType(incidentType).build());
        }
    }

    @Test
    void overRepresentedTypeIsFlagged() {
        List<EventRecord> events = new ArrayList<>();
        add(events, "shooting", 10);
        add(events, "theft", 34);
        add(events, "assault", 15);
        add(events, "burglary", 12);
        add(events, "vandalism", 10);
        add(events, "drug", 8);
        add(events, "robbery", 5);
        add(events, "homicide", 1);
        add(events, "other", 5);

        // 100 incidents: shooting 10% vs 3% expected
        List<AnomalyRecord> anomalies = strategy.detect(events);

        assertThat(anomalies).singleElement().satisfies(a -> {
            assertThat(a.getMetrics()).containsEntry("crime_type", "shooting").containsEntry("count", 10);
            assertThat((double) a.getMetrics().get("ratio")).isCloseTo(3.333, within(0.001));
            assertThat(a.getSeverity()).isCloseTo(1.0, within(1e-9));
            assertThat(a.getConfidence()).isEqualTo(0.7);
            assertThat(a.getDescription()).contains("shooting at 10.0%").contains("expected 3.0%");
        });
    }

    @Test
    void underRepresentedTypeIsFlagged() {
        List<EventRecord> events = new ArrayList<>();
        add(events, "theft", 1);
        add(events, "assault", 25);
        add(events, "burglary", 20);
        add(events, "vandalism", 18);
        add(events, "drug", 14);
        add(events, "robbery", 8);
        add(events, "shooting", 5);
        add(events, "homicide", 1);
        add(events, "other", 8);

        List<AnomalyRecord> anomalies = strategy.detect(events);

        assertThat(anomalies).extracting(a -> a.getMetrics().get("crime_type")).containsExactly("theft");
        assertThat(anomalies.get(0).getDeviation()).isNegative();
    }

    @Test
    void unknownCategoryUsesDefaultShare() {
        List<EventRecord> events = new ArrayList<>();
        add(events, null, 5);
        add(events, "theft", 5);

        List<AnomalyRecord> anomalies = strategy.detect(events);

        assertThat(anomalies).extracting(a -> a.getMetrics().get("crime_type")).contains("unknown");
    }

    @Test
    void nonIncidentEventsGiveNothing() {
        List<EventRecord> events = List.of(EventRecord.builder().eventType("cad_call").incidentType("theft").build());

        assertThat(strategy.detect(events)).isEmpty();
    }
}

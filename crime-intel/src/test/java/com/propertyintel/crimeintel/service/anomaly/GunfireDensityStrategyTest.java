package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.service.baseline.BaselineTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class GunfireDensityStrategyTest {

    private BaselineTracker baselines;
    private GunfireDensityStrategy strategy;

    @BeforeEach
    void setUp() {
        baselines = new BaselineTracker();
        strategy = new GunfireDensityStrategy(new CrimeIntelProperties(), baselines);
    }

    private static List<EventRecord> shots(int count, double lat, double lon) {
        List<EventRecord> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(EventRecord.builder()
                    .eventId("shot-" + lat + "-" + i)
                    .source("shotspotter")
                    .latitude(lat + i * 0.0001)
                    .longitude(lon)
                    .build());
        }
        return events;
    }

    @Test
    void denseCellScoresAgainstSeededPrior() {
        // prior mean 2.0, std 1.5: six shots give z = 2.67
        List<AnomalyRecord> anomalies = strategy.detect(shots(6, 54.601, -5.931));

        assertThat(anomalies).hasSize(1);
        AnomalyRecord anomaly = anomalies.get(0);
        assertThat(anomaly.getDeviation()).isCloseTo(2.667, within(0.001));
        assertThat(anomaly.getConfidence()).isEqualTo(0.75);
        assertThat(anomaly.getSeverity()).isCloseTo(0.533, within(0.001));
        assertThat(anomaly.getMetrics()).containsEntry("event_count", 6);
        assertThat(anomaly.getBaseline()).containsEntry("mean", 2.0).containsEntry("std_dev", 1.5);
        assertThat(anomaly.getRelatedEntities()).hasSize(6);
    }

    @Test
    void veryDenseCellGetsHighConfidenceAndCappedRelatedList() {
        List<AnomalyRecord> anomalies = strategy.detect(shots(12, 54.601, -5.931));

        assertThat(anomalies).hasSize(1);
        assertThat(anomalies.get(0).getConfidence()).isEqualTo(0.9);
        assertThat(anomalies.get(0).getSeverity()).isEqualTo(1.0);
        assertThat(anomalies.get(0).getRelatedEntities()).hasSize(10);
    }

    @Test
    void sparseCellsAreNormal() {
        List<EventRecord> events = new ArrayList<>(shots(2, 54.601, -5.931));
        events.addAll(shots(3, 54.651, -5.931));

        assertThat(strategy.detect(events)).isEmpty();
    }

    @Test
    void learnedBaselineTakesPrecedenceOverPrior() {
        baselines.update(GunfireDensityStrategy.BASELINE_KEY, List.of(5.0, 6.0, 7.0));

        assertThat(strategy.detect(shots(6, 54.601, -5.931))).isEmpty();
    }

    @Test
    void gridCellsRoundHalfEvenOnTheExactValue() {
        GunfireDensityStrategy.GridCell cell = GunfireDensityStrategy.GridCell.of(54.6049, -5.9351);

        assertThat(cell.lat()).isEqualByComparingTo(new BigDecimal("54.60"));
        assertThat(cell.lon()).isEqualByComparingTo(new BigDecimal("-5.94"));
    }

    @Test
    void nonGunfireEventsAreIgnored() {
        List<EventRecord> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(EventRecord.builder().source("cad").latitude(54.6).longitude(-5.93).build());
        }

        assertThat(strategy.detect(events)).isEmpty();
    }
}

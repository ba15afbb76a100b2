package com.propertyintel.crimeintel.service.anomaly;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.AnomalyRecord;
import com.propertyintel.crimeintel.model.EventRecord;
import com.propertyintel.crimeintel.service.baseline.BaselineTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TimelineDeviationStrategyTest {

    private BaselineTracker baselines;
    private TimelineDeviationStrategy strategy;

    @BeforeEach
    void setUp() {
        baselines = new BaselineTracker();
        strategy = new TimelineDeviationStrategy(new CrimeIntelProperties(), baselines);
    }

    private static List<EventRecord> eventsAt(int count, OffsetDateTime at) {
        List<EventRecord> events = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            events.add(EventRecord.builder().eventId("e" + i).timestamp(at.plusMinutes(i % 60)).build());
        }
        return events;
    }

    @Test
    void spikeInOneHourIsFlagged() {
        // prior mean is the average expected hourly count (~8.83) with std 4.0
        List<AnomalyRecord> anomalies = strategy.detect(eventsAt(20, OffsetDateTime.of(2024, 1, 15, 3, 0, 0, 0, ZoneOffset.UTC)));

        assertThat(anomalies).hasSize(1);
        AnomalyRecord anomaly = anomalies.get(0);
        assertThat(anomaly.getMetrics()).containsEntry("hour", 3).containsEntry("count", 20);
        assertThat(anomaly.getDeviation()).isCloseTo((20 - 212.0 / 24) / 4.0, within(1e-9));
        assertThat(anomaly.getConfidence()).isEqualTo(0.8);
        assertThat(anomaly.getLocation()).isNull();
        assertThat(anomaly.getDescription()).startsWith("Unusual event volume at hour 03:00 - 20 events");
    }

    @Test
    void ordinaryVolumeIsNormal() {
        assertThat(strategy.detect(eventsAt(10, OffsetDateTime.of(2024, 1, 15, 14, 0, 0, 0, ZoneOffset.UTC)))).isEmpty();
    }

    @Test
    void hourIsTakenInTheEventsOwnOffset() {
        OffsetDateTime localMidnight = OffsetDateTime.of(2024, 1, 15, 0, 0, 0, 0, ZoneOffset.ofHours(5));

        List<AnomalyRecord> anomalies = strategy.detect(eventsAt(25, localMidnight));

        assertThat(anomalies).singleElement()
                .satisfies(a -> assertThat(a.getMetrics()).containsEntry("hour", 0));
    }

    @Test
    void eventsWithoutTimestampAreIgnored() {
        List<EventRecord> events = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            events.add(EventRecord.builder().eventId("e" + i).build());
        }

        assertThat(strategy.detect(events)).isEmpty();
    }

    @Test
    void seedPriorsInstallsTheHourlyBaseline() {
        strategy.seedPriors();

        assertThat(baselines.get(TimelineDeviationStrategy.BASELINE_KEY)).hasValueSatisfying(m -> {
            assertThat(m.getMean()).isCloseTo(212.0 / 24, within(1e-9));
            assertThat(m.getStdDev()).isEqualTo(4.0);
        });
    }
}

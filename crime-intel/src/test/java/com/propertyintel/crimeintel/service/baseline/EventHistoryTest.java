package com.propertyintel.crimeintel.service.baseline;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.EventRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventHistoryTest {

    private static final OffsetDateTime T0 = OffsetDateTime.of(2024, 3, 1, 12, 0, 0, 0, ZoneOffset.UTC);

    private static EventRecord event(String type, OffsetDateTime at) {
        return EventRecord.builder().eventId(type + "-" + at).type(type).timestamp(at).build();
    }

    private static EventHistory history(Duration retention, int cap) {
        CrimeIntelProperties properties = new CrimeIntelProperties();
        properties.getHistory().setRetention(retention);
        properties.getHistory().setMaxEventsPerType(cap);
        return new EventHistory(properties);
    }

    @Test
    void eventsWithoutTimestampAreNotRetained() {
        EventHistory history = history(Duration.ofDays(30), 100);

        int retained = history.append(List.of(
                event("gunfire", T0),
                EventRecord.builder().type("gunfire").build()));

        assertThat(retained).isEqualTo(1);
        assertThat(history.size()).isEqualTo(1);
    }

    @Test
    void eventsOutsideRetentionWindowAreDropped() {
        EventHistory history = history(Duration.ofDays(30), 100);

        history.append(List.of(event("gunfire", T0.minusDays(45)), event("gunfire", T0.minusDays(10))));
        history.append(List.of(event("gunfire", T0)));

        assertThat(history.snapshot().get("gunfire"))
                .extracting(EventRecord::getTimestamp)
                .containsExactly(T0.minusDays(10), T0);
    }

    @Test
    void capKeepsNewestEvents() {
        EventHistory history = history(Duration.ofDays(365), 3);

        history.append(List.of(
                event("cad_call", T0.plusHours(1)),
                event("cad_call", T0.plusHours(2)),
                event("cad_call", T0.plusHours(3)),
                event("cad_call", T0.plusHours(4))));

        assertThat(history.snapshot().get("cad_call"))
                .extracting(EventRecord::getTimestamp)
                .containsExactly(T0.plusHours(2), T0.plusHours(3), T0.plusHours(4));
    }

    @Test
    void lateArrivalsAreMergedInTimeOrder() {
        EventHistory history = history(Duration.ofDays(30), 100);

        history.append(List.of(event("incident", T0.plusHours(5))));
        history.append(List.of(event("incident", T0.plusHours(1))));

        assertThat(history.snapshot().get("incident"))
                .extracting(EventRecord::getTimestamp)
                .containsExactly(T0.plusHours(1), T0.plusHours(5));
    }

    @Test
    void typesAreBoundedIndependently() {
        EventHistory history = history(Duration.ofDays(1), 100);

        history.append(List.of(event("a", T0.minusDays(10)), event("b", T0)));

        assertThat(history.snapshot()).containsOnlyKeys("a", "b");
        assertThat(history.size()).isEqualTo(2);
    }

    @Test
    void evictExpiredReportsNothingWhenAlreadyTrimmed() {
        EventHistory history = history(Duration.ofDays(30), 100);
        history.append(List.of(event("a", T0)));

        assertThat(history.evictExpired()).isZero();

        history.clear();
        assertThat(history.size()).isZero();
    }
}

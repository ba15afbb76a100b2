package com.propertyintel.crimeintel.service.baseline;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.EventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Historical events per type, kept for baseline recalculation.
 *
 * Bounded two ways: events older than the retention window (measured back
 * from the newest event of the same type) are evicted, and each type keeps
 * at most {@code maxEventsPerType} events, oldest dropped first.
 */
@Component
@Slf4j
public class EventHistory {

    private final Duration retention;
    private final int maxEventsPerType;

    private final Map<String, Deque<EventRecord>> byType = new LinkedHashMap<>();

    public EventHistory(CrimeIntelProperties properties) {
        this.retention = properties.getHistory().getRetention();
        this.maxEventsPerType = properties.getHistory().getMaxEventsPerType();
    }

    /**
     * Append events with a timestamp; events without one are not retained.
     *
     * @return number of events retained
     */
    public synchronized int append(List<EventRecord> events) {
        Map<String, List<EventRecord>> incoming = new LinkedHashMap<>();
        for (EventRecord event : events) {
            if (!event.hasTimestamp()) continue;
            incoming.computeIfAbsent(event.typeKey(), k -> new ArrayList<>()).add(event);
        }

        int retained = 0;
        for (Map.Entry<String, List<EventRecord>> entry : incoming.entrySet()) {
            List<EventRecord> batch = entry.getValue();
            batch.sort(Comparator.comparing(e -> e.getTimestamp().toInstant()));

            Deque<EventRecord> deque = byType.computeIfAbsent(entry.getKey(), k -> new ArrayDeque<>());
            if (!deque.isEmpty() && isBefore(batch.get(0), deque.peekLast())) {
                // Out-of-order arrival: merge and re-sort this type once
                List<EventRecord> merged = new ArrayList<>(deque);
                merged.addAll(batch);
                merged.sort(Comparator.comparing(e -> e.getTimestamp().toInstant()));
                deque.clear();
                deque.addAll(merged);
            } else {
                deque.addAll(batch);
            }
            retained += batch.size();
            trim(entry.getKey(), deque);
        }
        return retained;
    }

    /**
     * Drop expired events for every type.
     *
     * @return number of events removed
     */
    public synchronized int evictExpired() {
        int before = size();
        byType.forEach(this::trim);
        byType.values().removeIf(Deque::isEmpty);
        int removed = before - size();
        if (removed > 0) {
            log.info("Evicted {} expired events from history", removed);
        }
        return removed;
    }

    /** Copy of the current history, oldest first within each type. */
    public synchronized Map<String, List<EventRecord>> snapshot() {
        Map<String, List<EventRecord>> copy = new LinkedHashMap<>();
        byType.forEach((type, deque) -> copy.put(type, List.copyOf(deque)));
        return copy;
    }

    public synchronized int size() {
        return byType.values().stream().mapToInt(Deque::size).sum();
    }

    public synchronized void clear() {
        byType.clear();
    }

    private void trim(String type, Deque<EventRecord> deque) {
        while (deque.size() > maxEventsPerType) {
            deque.pollFirst();
        }
        if (deque.isEmpty()) return;

        OffsetDateTime cutoff = deque.peekLast().getTimestamp().minus(retention);
        while (!deque.isEmpty() && deque.peekFirst().getTimestamp().isBefore(cutoff)) {
            deque.pollFirst();
        }
        log.debug("History for {} holds {} events", type, deque.size());
    }

    private static boolean isBefore(EventRecord a, EventRecord b) {
        return a.getTimestamp().toInstant().isBefore(b.getTimestamp().toInstant());
    }
}

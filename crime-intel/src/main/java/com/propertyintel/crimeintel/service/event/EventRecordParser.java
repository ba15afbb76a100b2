package com.propertyintel.crimeintel.service.event;

import com.propertyintel.crimeintel.model.EventRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps loosely-keyed event maps from the ingest stream to {@link EventRecord}.
 *
 * Never throws on bad input: a missing or unreadable key leaves the field
 * null, unknown keys are ignored.
 */
@Component
@Slf4j
public class EventRecordParser {

    public List<EventRecord> parseAll(List<Map<String, Object>> raw) {
        if (raw == null || raw.isEmpty()) return List.of();

        List<EventRecord> events = new ArrayList<>(raw.size());
        int skipped = 0;
        for (Map<String, Object> item : raw) {
            if (item == null) {
                skipped++;
                continue;
            }
            try {
                events.add(parse(item));
            } catch (RuntimeException e) {
                log.debug("Unreadable event {}: {}", item.keySet(), e.getMessage());
                skipped++;
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} null or unreadable event entries", skipped);
        }
        return events;
    }

    public EventRecord parse(Map<String, Object> raw) {
        return EventRecord.builder()
                .eventId(text(raw, "event_id", "id"))
                .entityId(text(raw, "entity_id", "id"))
                .source(lower(text(raw, "source")))
                .eventType(lower(text(raw, "event_type")))
                .type(lower(text(raw, "type")))
                .entityType(lower(text(raw, "entity_type")))
                .incidentType(text(raw, "incident_type", "crime_type", "category"))
                .timestamp(TimestampParser.parse(first(raw, "timestamp", "created_at")))
                .latitude(coordinate(raw.get("latitude"), 90))
                .longitude(coordinate(raw.get("longitude"), 180))
                .plate(text(raw, "plate_number", "plate"))
                .callerId(text(raw, "caller_id", "caller_phone", "reporting_party"))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Object first(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null && !(value instanceof String s && s.isBlank())) {
                return value;
            }
        }
        return null;
    }

    private String text(Map<String, Object> raw, String... keys) {
        Object value = first(raw, keys);
        return value == null ? null : value.toString().trim();
    }

    private String lower(String val) {
        return val == null ? null : val.toLowerCase(Locale.ROOT);
    }

    static Double coordinate(Object value, double limit) {
        Double parsed = parseDouble(value);
        if (parsed == null || parsed.isNaN() || Math.abs(parsed) > limit) return null;
        return parsed;
    }

    static Double parseDouble(Object value) {
        if (value == null) return null;
        if (value instanceof Number number) return number.doubleValue();
        String val = value.toString();
        if (val.isBlank()) return null;
        try {
            return Double.parseDouble(val.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}

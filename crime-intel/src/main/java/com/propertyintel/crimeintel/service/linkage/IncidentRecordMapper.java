package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.service.event.TimestampParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps incident property maps, as returned by the graph store or as search
 * {@code _source} documents, to {@link IncidentRecord}.
 */
@Component
@Slf4j
public class IncidentRecordMapper {

    /**
     * @return the mapped incident, or null when the map carries no incident id
     */
    public IncidentRecord map(Map<String, Object> raw) {
        if (raw == null) return null;

        String incidentId = text(raw, "incident_id", "id");
        if (incidentId == null) {
            log.debug("Dropping incident without id: {}", raw.keySet());
            return null;
        }

        Map<String, Object> location = nested(raw.get("location"));

        return IncidentRecord.builder()
                .incidentId(incidentId)
                .incidentType(text(raw, "incident_type", "type"))
                .timestamp(TimestampParser.parse(first(raw, "timestamp", "occurred_at")))
                .latitude(coordinate(raw, location, "latitude", 90))
                .longitude(coordinate(raw, location, "longitude", 180))
                .address(raw.get("location") instanceof String s ? emptyToNull(s) : text(raw, "address"))
                .summary(text(raw, "summary"))
                .narrative(text(raw, "narrative", "description"))
                .moFactors(stringMap(raw.get("mo_factors")))
                .suspectDescription(stringMap(first(raw, "suspect_description", "suspect")))
                .weaponType(text(raw, "weapon_type", "weapon"))
                .callerId(text(raw, "caller_id", "caller_phone", "reporting_party"))
                .placeholder(false)
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Double coordinate(Map<String, Object> raw, Map<String, Object> location, String key, double limit) {
        Double value = parseCoordinate(raw.get(key), limit);
        return value != null ? value : parseCoordinate(location.get(key), limit);
    }

    private Double parseCoordinate(Object value, double limit) {
        Double parsed = null;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else if (value != null && !value.toString().isBlank()) {
            try {
                parsed = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (parsed == null || parsed.isNaN() || Math.abs(parsed) > limit) return null;
        return parsed;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> nested(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private Map<String, String> stringMap(Object value) {
        if (!(value instanceof Map<?, ?> map)) return Map.of();
        Map<String, String> result = new LinkedHashMap<>();
        map.forEach((k, v) -> {
            if (k != null && v != null && !v.toString().isBlank()) {
                result.put(k.toString(), v.toString().trim());
            }
        });
        return Collections.unmodifiableMap(result);
    }

    private Object first(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null && !(value instanceof String s && s.isBlank())) return value;
        }
        return null;
    }

    private String text(Map<String, Object> raw, String... keys) {
        Object value = first(raw, keys);
        if (value == null || value instanceof Map<?, ?>) return null;
        return value.toString().trim();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}

package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.model.IncidentRecord;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentRecordMapperTest {

    private final IncidentRecordMapper mapper = new IncidentRecordMapper();

    @Test
    void mapsFlatGraphProperties() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("incident_id", "INC-1");
        raw.put("incident_type", "burglary");
        raw.put("timestamp", "2024-01-15T22:00:00Z");
        raw.put("latitude", 54.5973);
        raw.put("longitude", "-5.9301");
        raw.put("address", "12 Main St");
        raw.put("narrative", "Rear window forced");
        raw.put("mo_factors", Map.of("entry_method", "rear window", "weapon_used", ""));
        raw.put("suspect_description", Map.of("sex", "male"));
        raw.put("weapon_type", "screwdriver");
        raw.put("caller_id", "555-0100");

        IncidentRecord incident = mapper.map(raw);

        assertThat(incident.getIncidentId()).isEqualTo("INC-1");
        assertThat(incident.getIncidentType()).isEqualTo("burglary");
        assertThat(incident.getTimestamp()).isNotNull();
        assertThat(incident.getLatitude()).isEqualTo(54.5973);
        assertThat(incident.getLongitude()).isEqualTo(-5.9301);
        assertThat(incident.getAddress()).isEqualTo("12 Main St");
        assertThat(incident.getMoFactors()).containsOnlyKeys("entry_method");
        assertThat(incident.getSuspectDescription()).containsEntry("sex", "male");
        assertThat(incident.getWeaponType()).isEqualTo("screwdriver");
        assertThat(incident.getCallerId()).isEqualTo("555-0100");
        assertThat(incident.isPlaceholder()).isFalse();
    }

    @Test
    void readsAlternateKeysAndNestedLocation() {
        IncidentRecord incident = mapper.map(Map.of(
                "id", "INC-2",
                "type", "robbery",
                "occurred_at", "2024-01-16 01:30:00",
                "location", Map.of("latitude", 54.6, "longitude", -5.93),
                "description", "Street robbery"));

        assertThat(incident.getIncidentId()).isEqualTo("INC-2");
        assertThat(incident.getIncidentType()).isEqualTo("robbery");
        assertThat(incident.getTimestamp().getHour()).isEqualTo(1);
        assertThat(incident.hasCoordinates()).isTrue();
        assertThat(incident.narrativeText()).isEqualTo("Street robbery");
    }

    @Test
    void textualLocationBecomesTheAddress() {
        IncidentRecord incident = mapper.map(Map.of("incident_id", "INC-3", "location", "Botanic Avenue"));

        assertThat(incident.getAddress()).isEqualTo("Botanic Avenue");
        assertThat(incident.hasCoordinates()).isFalse();
    }

    @Test
    void recordWithoutIdIsDropped() {
        assertThat(mapper.map(Map.of("incident_type", "theft"))).isNull();
        assertThat(mapper.map(null)).isNull();
    }
}

package com.propertyintel.crimeintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * An incident as resolved from the graph store or search index.
 *
 * Resolution never fails outright: an id nobody can resolve comes back as a
 * placeholder with only the id and a generic summary filled in.
 */
@Value
@Builder(toBuilder = true)
public class IncidentRecord {

    String incidentId;
    String incidentType;
    OffsetDateTime timestamp;
    Double latitude;
    Double longitude;
    String address;
    String summary;
    String narrative;

    /** entry_method, weapon_used, target_type, ... */
    Map<String, String> moFactors;

    /** sex, race, age_range, height, build, hair, clothing, ... */
    Map<String, String> suspectDescription;

    String weaponType;
    String callerId;

    boolean placeholder;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    /** Text used for narrative similarity: the narrative, else the summary. */
    public String narrativeText() {
        if (narrative != null && !narrative.isBlank()) return narrative;
        return summary;
    }

    public static IncidentRecord placeholder(String incidentId) {
        return IncidentRecord.builder()
                .incidentId(incidentId)
                .incidentType("unknown")
                .summary("Incident " + incidentId)
                .moFactors(Map.of())
                .suspectDescription(Map.of())
                .placeholder(true)
                .build();
    }
}

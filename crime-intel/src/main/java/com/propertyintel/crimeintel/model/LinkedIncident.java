package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Short description of an incident pulled into a linkage result.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LinkedIncident {

    private static final int SUMMARY_LENGTH = 200;

    String incidentId;
    String incidentType;
    OffsetDateTime timestamp;
    GeoLocation location;
    String address;
    String summary;

    public static LinkedIncident of(IncidentRecord incident) {
        String summary = incident.getSummary();
        if (summary == null || summary.isBlank()) {
            String narrative = incident.getNarrative() == null ? "" : incident.getNarrative();
            summary = narrative.length() > SUMMARY_LENGTH ? narrative.substring(0, SUMMARY_LENGTH) : narrative;
        }
        return LinkedIncident.builder()
                .incidentId(incident.getIncidentId())
                .incidentType(incident.getIncidentType())
                .timestamp(incident.getTimestamp())
                .location(incident.hasCoordinates()
                        ? new GeoLocation(incident.getLatitude(), incident.getLongitude())
                        : null)
                .address(incident.getAddress())
                .summary(summary)
                .build();
    }
}

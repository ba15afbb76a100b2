package com.propertyintel.crimeintel.model;

import lombok.Builder;
import lombok.Value;

import java.time.OffsetDateTime;

/**
 * Typed view of one loosely-keyed event from the ingest stream.
 *
 * Every field is optional. The parser leaves a field null when the key is
 * absent or its value cannot be read, and each detection strategy decides
 * for itself which fields it needs.
 */
@Value
@Builder
public class EventRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** event_id, falling back to id */
    String eventId;

    /** entity_id, falling back to id */
    String entityId;

    // ── Classification ──────────────────────────────────────────────────────
    /** Feed that produced the event, e.g. flock, shotspotter, cad */
    String source;

    /** e.g. lpr_read, gunfire, cad_call, incident */
    String eventType;

    /** Generic type tag, e.g. person, incident */
    String type;

    /** e.g. person, vehicle */
    String entityType;

    /** incident_type, crime_type or category, whichever came first */
    String incidentType;

    // ── Time & place ────────────────────────────────────────────────────────
    /** timestamp or created_at; keeps the offset the event was reported in */
    OffsetDateTime timestamp;

    Double latitude;
    Double longitude;

    // ── Subject keys ────────────────────────────────────────────────────────
    /** plate_number or plate */
    String plate;

    /** caller_id, caller_phone or reporting_party */
    String callerId;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public boolean hasTimestamp() {
        return timestamp != null;
    }

    /** Bucket key used for per-type history and baselines. */
    public String typeKey() {
        if (type != null) return type;
        if (eventType != null) return eventType;
        return "unknown";
    }
}

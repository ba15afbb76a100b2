package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyType {
    VEHICLE_BEHAVIOR("vehicle_behavior"),
    GUNFIRE_DENSITY("gunfire_density"),
    OFFENDER_CLUSTERING("offender_clustering"),
    TIMELINE_DEVIATION("timeline_deviation"),
    CRIME_SIGNATURE_SHIFT("crime_signature_shift"),
    REPEAT_CALLER("repeat_caller");

    private final String value;

    AnomalyType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}

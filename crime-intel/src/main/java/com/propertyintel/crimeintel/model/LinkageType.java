package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of evidence that can relate two incidents, each with the base weight
 * applied before the evidence's own strength factor.
 */
public enum LinkageType {
    BALLISTIC_MATCH("ballistic_match", 0.95),
    ENTITY_OVERLAP("entity_overlap", 0.85),
    VEHICLE_RECURRENCE("vehicle_recurrence", 0.80),
    MO_SIMILARITY("mo_similarity", 0.75),
    SUSPECT_DESCRIPTION("suspect_description", 0.70),
    WEAPON_TYPE("weapon_type", 0.65),
    GEOGRAPHIC("geographic", 0.60),
    NARRATIVE_SIMILARITY("narrative_similarity", 0.55),
    TEMPORAL("temporal", 0.50),
    REPEAT_CALLER("repeat_caller", 0.45);

    private final String value;
    private final double weight;

    LinkageType(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double getWeight() {
        return weight;
    }

    /** Base weight scaled by a strength factor in [0, 1]. */
    public double weigh(double strength) {
        return Math.max(0.0, Math.min(1.0, strength)) * weight;
    }
}

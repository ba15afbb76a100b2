package com.propertyintel.crimeintel.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one linkage request. Built once and not modified afterwards.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LinkageResult {

    /** Seeds plus every incident a surviving edge points at */
    List<LinkedIncident> linkedIncidents;

    /** Deduplicated edges */
    List<LinkageEdge> linkages;

    /** Incident id → highest confidence among the edges touching it */
    Map<String, Double> confidenceScores;

    /** One line per edge, or a single note when nothing was found */
    List<String> explanations;

    public static LinkageResult empty(String note) {
        return LinkageResult.builder()
                .linkedIncidents(List.of())
                .linkages(List.of())
                .confidenceScores(Map.of())
                .explanations(List.of(note))
                .build();
    }
}

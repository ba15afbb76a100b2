package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;

import java.util.List;

/**
 * One kind of evidence relating a seed incident to other incidents.
 *
 * Batch strategies compare the seed against the other resolved incidents.
 * Collaborator strategies query the graph store or search index and may
 * return incidents outside the batch.
 */
public interface EvidenceStrategy {

    LinkageType getType();

    /** True when this strategy makes a blocking graph or search call. */
    default boolean usesCollaborator() {
        return false;
    }

    /** False when the collaborator this strategy needs is not configured. */
    default boolean isAvailable() {
        return true;
    }

    /**
     * @param incident the seed incident
     * @param batch    every resolved seed incident, {@code incident} included
     * @return edges from {@code incident}, each at or above the confidence threshold
     */
    List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch);
}

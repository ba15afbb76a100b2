package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.GraphStoreClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evidence read from the graph store: one Cypher query per seed incident,
 * one candidate edge per returned row.
 */
@Slf4j
public abstract class GraphEvidenceStrategy extends AbstractEvidenceStrategy {

    private final GraphStoreClient graph;

    protected GraphEvidenceStrategy(Optional<GraphStoreClient> graph, CrimeIntelProperties properties) {
        super(properties);
        this.graph = graph.orElse(null);
    }

    protected abstract String query();

    /** Edge for one result row, if the row carries enough evidence. */
    protected abstract Optional<LinkageEdge> toEdge(String incidentId, Map<String, Object> row);

    @Override
    public boolean usesCollaborator() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return graph != null;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        if (graph == null) return edges;

        try {
            List<Map<String, Object>> rows = graph.executeQuery(query(), Map.of("incident_id", incident.getIncidentId()));
            for (Map<String, Object> row : rows) {
                toEdge(incident.getIncidentId(), row).ifPresent(edges::add);
            }
        } catch (Exception e) {
            log.warn("Error finding {} links for {}: {}", getType().getValue(), incident.getIncidentId(), e.getMessage());
        }
        return edges;
    }
}

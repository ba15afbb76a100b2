package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.SearchClient;
import com.propertyintel.crimeintel.client.SearchHit;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evidence read from the search index: one query per seed incident, one
 * candidate edge per hit, strength derived from the relevance score.
 */
@Slf4j
public abstract class SearchEvidenceStrategy extends AbstractEvidenceStrategy {

    private final SearchClient search;

    protected SearchEvidenceStrategy(Optional<SearchClient> search, CrimeIntelProperties properties) {
        super(properties);
        this.search = search.orElse(null);
    }

    /** Query body for this incident, or empty when the incident offers nothing to search on. */
    protected abstract Optional<Map<String, Object>> query(IncidentRecord incident);

    protected abstract int resultSize();

    protected abstract Optional<LinkageEdge> toEdge(IncidentRecord incident, String otherId, double score);

    @Override
    public boolean usesCollaborator() {
        return true;
    }

    @Override
    public boolean isAvailable() {
        return search != null;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        if (search == null) return edges;

        Optional<Map<String, Object>> query = query(incident);
        if (query.isEmpty()) return edges;

        try {
            List<SearchHit> hits = search.search(linkage.getSearchIndex(), query.get(), resultSize());
            for (SearchHit hit : hits) {
                String otherId = hit.sourceText("incident_id");
                toEdge(incident, otherId != null ? otherId : hit.id(), hit.score()).ifPresent(edges::add);
            }
        } catch (Exception e) {
            log.warn("Error finding {} links for {}: {}", getType().getValue(), incident.getIncidentId(), e.getMessage());
        }
        return edges;
    }

    protected static Map<String, Object> excludeIncident(String incidentId) {
        return Map.of("term", Map.of("incident_id", incidentId));
    }
}

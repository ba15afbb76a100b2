package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.SearchClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recent incidents of the same type sharing modus operandi factors.
 * A relevance score of 5 or more counts as full strength.
 */
@Component
@Order(7)
public class MoSimilarityEvidenceStrategy extends SearchEvidenceStrategy {

    static final List<String> MO_FIELDS = List.of("entry_method", "weapon_used", "target_type");
    static final double FULL_STRENGTH_SCORE = 5.0;

    public MoSimilarityEvidenceStrategy(Optional<SearchClient> search, CrimeIntelProperties properties) {
        super(search, properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.MO_SIMILARITY;
    }

    @Override
    protected Optional<Map<String, Object>> query(IncidentRecord incident) {
        String type = incident.getIncidentType();
        if (incident.isPlaceholder() || type == null || type.isBlank()) return Optional.empty();

        List<Map<String, Object>> should = new ArrayList<>();
        Map<String, String> mo = incident.getMoFactors() == null ? Map.of() : incident.getMoFactors();
        for (String field : MO_FIELDS) {
            String value = mo.get(field);
            if (value != null && !value.isBlank()) {
                should.add(Map.of("match", Map.of("mo_factors." + field, value)));
            }
        }
        should.add(Map.of("range", Map.of("timestamp",
                Map.of("gte", "now-" + linkage.getMoLookbackDays() + "d"))));

        return Optional.of(Map.of("query", Map.of("bool", Map.of(
                "must", List.of(Map.of("term", Map.of("incident_type", type))),
                "must_not", List.of(excludeIncident(incident.getIncidentId())),
                "should", should,
                "minimum_should_match", 1))));
    }

    @Override
    protected int resultSize() {
        return linkage.getMoResultSize();
    }

    @Override
    protected Optional<LinkageEdge> toEdge(IncidentRecord incident, String otherId, double score) {
        return edge(incident.getIncidentId(), otherId, Math.min(1.0, score / FULL_STRENGTH_SCORE),
                "Similar M.O. pattern for " + incident.getIncidentType() + " incidents",
                metadata("mo_score", score));
    }
}

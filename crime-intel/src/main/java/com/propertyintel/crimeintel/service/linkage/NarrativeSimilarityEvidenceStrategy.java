package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.SearchClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Incidents whose narratives read alike, found with a more-like-this query.
 * A relevance score of 10 or more counts as full strength.
 */
@Component
@Order(4)
public class NarrativeSimilarityEvidenceStrategy extends SearchEvidenceStrategy {

    static final double FULL_STRENGTH_SCORE = 10.0;

    public NarrativeSimilarityEvidenceStrategy(Optional<SearchClient> search, CrimeIntelProperties properties) {
        super(search, properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.NARRATIVE_SIMILARITY;
    }

    @Override
    protected Optional<Map<String, Object>> query(IncidentRecord incident) {
        String narrative = incident.narrativeText();
        if (incident.isPlaceholder() || narrative == null || narrative.isBlank()) return Optional.empty();

        Map<String, Object> moreLikeThis = Map.of("more_like_this", Map.of(
                "fields", List.of("narrative", "summary", "description"),
                "like", narrative,
                "min_term_freq", 1,
                "min_doc_freq", 1));

        return Optional.of(Map.of("query", Map.of("bool", Map.of(
                "must", List.of(moreLikeThis),
                "must_not", List.of(excludeIncident(incident.getIncidentId()))))));
    }

    @Override
    protected int resultSize() {
        return linkage.getNarrativeResultSize();
    }

    @Override
    protected Optional<LinkageEdge> toEdge(IncidentRecord incident, String otherId, double score) {
        return edge(incident.getIncidentId(), otherId, Math.min(1.0, score / FULL_STRENGTH_SCORE),
                String.format(Locale.ROOT, "Incident narratives have similar content (score: %.2f)", score),
                metadata("similarity_score", score));
    }
}

package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Incidents whose suspect descriptions agree. Only descriptor fields present
 * on both sides are compared, and at least two must be comparable.
 */
@Component
@Order(8)
public class SuspectDescriptionEvidenceStrategy extends AbstractEvidenceStrategy {

    static final int MIN_COMPARED_FIELDS = 2;

    public SuspectDescriptionEvidenceStrategy(CrimeIntelProperties properties) {
        super(properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.SUSPECT_DESCRIPTION;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        Map<String, String> description = incident.getSuspectDescription();
        if (description == null || description.size() < MIN_COMPARED_FIELDS) return edges;

        for (IncidentRecord other : batch) {
            if (other.getIncidentId().equals(incident.getIncidentId())) continue;
            Map<String, String> otherDescription = other.getSuspectDescription();
            if (otherDescription == null || otherDescription.isEmpty()) continue;

            int compared = 0;
            List<String> matched = new ArrayList<>();
            for (Map.Entry<String, String> field : description.entrySet()) {
                String otherValue = otherDescription.get(field.getKey());
                if (otherValue == null) continue;
                compared++;
                if (sameText(field.getValue(), otherValue)) {
                    matched.add(field.getKey());
                }
            }
            if (compared < MIN_COMPARED_FIELDS || matched.isEmpty()) continue;

            edge(incident.getIncidentId(), other.getIncidentId(), (double) matched.size() / compared,
                    String.format(Locale.ROOT, "Suspect descriptions match on %d of %d fields (%s)",
                            matched.size(), compared, String.join(", ", matched)),
                    metadata("matched_fields", List.copyOf(matched), "compared_fields", compared))
                    .ifPresent(edges::add);
        }
        return edges;
    }
}

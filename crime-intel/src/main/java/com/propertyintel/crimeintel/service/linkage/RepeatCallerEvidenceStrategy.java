package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Incidents reported by the same caller.
 */
@Component
@Order(10)
public class RepeatCallerEvidenceStrategy extends AbstractEvidenceStrategy {

    public RepeatCallerEvidenceStrategy(CrimeIntelProperties properties) {
        super(properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.REPEAT_CALLER;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        String caller = incident.getCallerId();
        if (caller == null || caller.isBlank()) return edges;

        for (IncidentRecord other : batch) {
            if (other.getIncidentId().equals(incident.getIncidentId())) continue;
            if (!sameText(caller, other.getCallerId())) continue;

            edge(incident.getIncidentId(), other.getIncidentId(), 1.0,
                    "Both incidents reported by caller " + caller,
                    metadata("caller_id", caller))
                    .ifPresent(edges::add);
        }
        return edges;
    }
}

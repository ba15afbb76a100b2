package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Incidents close in time. Strength falls linearly to zero at the edge of
 * the temporal window.
 */
@Component
@Order(1)
public class TemporalEvidenceStrategy extends AbstractEvidenceStrategy {

    public TemporalEvidenceStrategy(CrimeIntelProperties properties) {
        super(properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.TEMPORAL;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        if (incident.getTimestamp() == null) return edges;

        double window = linkage.getTemporalWindowHours();
        for (IncidentRecord other : batch) {
            if (other.getTimestamp() == null || other.getIncidentId().equals(incident.getIncidentId())) continue;

            double hours = Math.abs(Duration.between(incident.getTimestamp(), other.getTimestamp()).toMillis()) / 3_600_000.0;
            if (hours > window) continue;

            edge(incident.getIncidentId(), other.getIncidentId(), 1 - hours / window,
                    String.format(Locale.ROOT, "Incidents occurred within %.1f hours of each other", hours),
                    metadata("time_diff_hours", hours))
                    .ifPresent(edges::add);
        }
        return edges;
    }
}

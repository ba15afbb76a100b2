package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.geo.GeoMath;
import com.propertyintel.crimeintel.model.IncidentRecord;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Incidents close in space. Strength falls linearly to zero at the
 * configured radius.
 */
@Component
@Order(2)
public class GeographicEvidenceStrategy extends AbstractEvidenceStrategy {

    public GeographicEvidenceStrategy(CrimeIntelProperties properties) {
        super(properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.GEOGRAPHIC;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        if (!incident.hasCoordinates()) return edges;

        double radiusKm = linkage.getGeographicRadiusKm();
        for (IncidentRecord other : batch) {
            if (!other.hasCoordinates() || other.getIncidentId().equals(incident.getIncidentId())) continue;

            double distanceKm = GeoMath.haversineKm(
                    incident.getLatitude(), incident.getLongitude(),
                    other.getLatitude(), other.getLongitude());
            if (distanceKm > radiusKm) continue;

            edge(incident.getIncidentId(), other.getIncidentId(), 1 - distanceKm / radiusKm,
                    String.format(Locale.ROOT, "Incidents occurred within %.2f km of each other", distanceKm),
                    metadata("distance_km", distanceKm))
                    .ifPresent(edges::add);
        }
        return edges;
    }
}

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
 * Incidents reporting the same weapon type. Falls back to the
 * {@code weapon_used} MO factor when no weapon type is recorded.
 */
@Component
@Order(9)
public class WeaponTypeEvidenceStrategy extends AbstractEvidenceStrategy {

    public WeaponTypeEvidenceStrategy(CrimeIntelProperties properties) {
        super(properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.WEAPON_TYPE;
    }

    @Override
    public List<LinkageEdge> findLinks(IncidentRecord incident, List<IncidentRecord> batch) {
        List<LinkageEdge> edges = new ArrayList<>();
        String weapon = weaponOf(incident);
        if (weapon == null) return edges;

        for (IncidentRecord other : batch) {
            if (other.getIncidentId().equals(incident.getIncidentId())) continue;
            if (!sameText(weapon, weaponOf(other))) continue;

            edge(incident.getIncidentId(), other.getIncidentId(), 1.0,
                    "Same weapon type reported (" + weapon + ")",
                    metadata("weapon_type", weapon))
                    .ifPresent(edges::add);
        }
        return edges;
    }

    static String weaponOf(IncidentRecord incident) {
        if (incident.getWeaponType() != null && !incident.getWeaponType().isBlank()) {
            return incident.getWeaponType().trim();
        }
        if (incident.getMoFactors() == null) return null;
        String used = incident.getMoFactors().get("weapon_used");
        return used == null || used.isBlank() ? null : used.trim();
    }
}

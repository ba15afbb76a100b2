package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.GraphStoreClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Incidents with matching ballistic evidence. The query grades each match:
 * 1.0 for the same weapon, 0.7 for the same caliber, 0.5 otherwise.
 */
@Component
@Order(5)
public class BallisticEvidenceStrategy extends GraphEvidenceStrategy {

    static final String QUERY = """
            MATCH (i:Incident {incident_id: $incident_id})-[:HAS_EVIDENCE]->(b:BallisticEvidence)
            MATCH (b)-[:MATCHES]-(other_b:BallisticEvidence)<-[:HAS_EVIDENCE]-(other:Incident)
            WHERE other.incident_id <> $incident_id
            WITH other, b, other_b,
                 CASE WHEN b.weapon_id = other_b.weapon_id THEN 1.0
                      WHEN b.caliber = other_b.caliber THEN 0.7
                      ELSE 0.5 END AS match_strength
            RETURN other.incident_id AS other_id, match_strength,
                   b.caliber AS caliber, b.weapon_type AS weapon_type
            """;

    public BallisticEvidenceStrategy(Optional<GraphStoreClient> graph, CrimeIntelProperties properties) {
        super(graph, properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.BALLISTIC_MATCH;
    }

    @Override
    protected String query() {
        return QUERY;
    }

    @Override
    protected Optional<LinkageEdge> toEdge(String incidentId, Map<String, Object> row) {
        double strength = number(row.get("match_strength"));
        String caliber = text(row.get("caliber"));

        return edge(incidentId, text(row.get("other_id")), strength,
                String.format(Locale.ROOT, "Ballistic evidence match (%s caliber)", caliber == null ? "unknown" : caliber),
                metadata("match_strength", strength, "caliber", caliber, "weapon_type", text(row.get("weapon_type"))));
    }
}

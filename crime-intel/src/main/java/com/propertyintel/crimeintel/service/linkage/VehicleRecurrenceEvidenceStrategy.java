package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.GraphStoreClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Incidents involving the same vehicle. Each occurrence adds 0.3 to the
 * strength, capped at 1.
 */
@Component
@Order(6)
public class VehicleRecurrenceEvidenceStrategy extends GraphEvidenceStrategy {

    static final String QUERY = """
            MATCH (i:Incident {incident_id: $incident_id})-[:INVOLVES]->(v:Vehicle)
            MATCH (v)<-[:INVOLVES]-(other:Incident)
            WHERE other.incident_id <> $incident_id
            WITH other, v, count(*) AS occurrence_count
            RETURN other.incident_id AS other_id,
                   v.plate_number AS plate,
                   occurrence_count
            ORDER BY occurrence_count DESC
            """;

    static final double STRENGTH_PER_OCCURRENCE = 0.3;

    public VehicleRecurrenceEvidenceStrategy(Optional<GraphStoreClient> graph, CrimeIntelProperties properties) {
        super(graph, properties);
    }

    @Override
    public LinkageType getType() {
        return LinkageType.VEHICLE_RECURRENCE;
    }

    @Override
    protected String query() {
        return QUERY;
    }

    @Override
    protected Optional<LinkageEdge> toEdge(String incidentId, Map<String, Object> row) {
        long occurrences = (long) number(row.get("occurrence_count"));
        String plate = text(row.get("plate"));

        return edge(incidentId, text(row.get("other_id")),
                Math.min(1.0, occurrences * STRENGTH_PER_OCCURRENCE),
                "Vehicle " + plate + " appears in both incidents",
                metadata("plate_number", plate, "occurrence_count", occurrences));
    }
}

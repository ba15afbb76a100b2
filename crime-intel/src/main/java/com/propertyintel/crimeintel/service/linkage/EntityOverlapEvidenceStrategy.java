package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.GraphStoreClient;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.LinkageEdge;
import com.propertyintel.crimeintel.model.LinkageType;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Incidents sharing persons, vehicles or addresses in the graph. Each shared
 * entity adds 0.2 to the strength, capped at 1.
 */
@Component
@Order(3)
public class EntityOverlapEvidenceStrategy extends GraphEvidenceStrategy {

    static final String QUERY_TEMPLATE = """
            MATCH (i:Incident {incident_id: $incident_id})-[:INVOLVES|OCCURRED_AT|ASSOCIATED_WITH]-(e)
            MATCH (e)-[:INVOLVES|OCCURRED_AT|ASSOCIATED_WITH]-(other:Incident)
            WHERE other.incident_id <> $incident_id
            WITH other, collect(DISTINCT labels(e)[0]) AS entity_types, count(DISTINCT e) AS shared_count
            RETURN other.incident_id AS other_id, entity_types, shared_count
            ORDER BY shared_count DESC
            LIMIT %d
            """;

    static final double STRENGTH_PER_ENTITY = 0.2;

    private final String query;

    public EntityOverlapEvidenceStrategy(Optional<GraphStoreClient> graph, CrimeIntelProperties properties) {
        super(graph, properties);
        this.query = String.format(Locale.ROOT, QUERY_TEMPLATE, properties.getLinkage().getEntityOverlapLimit());
    }

    @Override
    public LinkageType getType() {
        return LinkageType.ENTITY_OVERLAP;
    }

    @Override
    protected String query() {
        return query;
    }

    @Override
    protected Optional<LinkageEdge> toEdge(String incidentId, Map<String, Object> row) {
        long shared = (long) number(row.get("shared_count"));
        if (shared <= 0) return Optional.empty();

        List<String> entityTypes = row.get("entity_types") instanceof List<?> types
                ? types.stream().map(String::valueOf).toList()
                : List.of();

        return edge(incidentId, text(row.get("other_id")),
                Math.min(1.0, shared * STRENGTH_PER_ENTITY),
                String.format(Locale.ROOT, "Incidents share %d entities (%s)", shared, String.join(", ", entityTypes)),
                metadata("shared_entity_count", shared, "entity_types", entityTypes));
    }
}

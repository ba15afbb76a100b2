package com.propertyintel.crimeintel.service.linkage;

import com.propertyintel.crimeintel.client.GraphStoreClient;
import com.propertyintel.crimeintel.client.SearchClient;
import com.propertyintel.crimeintel.client.SearchHit;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import com.propertyintel.crimeintel.model.IncidentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Resolves incident ids to records: graph store first, then the search index
 * for whatever the graph did not return, then placeholders. Every requested
 * id comes back with a record.
 */
@Component
@Slf4j
public class IncidentResolver {

    static final String FETCH_QUERY = """
            MATCH (i:Incident)
            WHERE i.incident_id IN $incident_ids OR i.id IN $incident_ids
            RETURN i
            """;

    private static final List<String> ID_KEYS = List.of("incident_id", "id");

    private final GraphStoreClient graph;
    private final SearchClient search;
    private final IncidentRecordMapper mapper;
    private final CrimeIntelProperties.Linkage linkage;
    private final Executor executor;

    public IncidentResolver(Optional<GraphStoreClient> graph,
                            Optional<SearchClient> search,
                            IncidentRecordMapper mapper,
                            CrimeIntelProperties properties,
                            @Qualifier("analysisExecutor") Executor executor) {
        this.graph = graph.orElse(null);
        this.search = search.orElse(null);
        this.mapper = mapper;
        this.linkage = properties.getLinkage();
        this.executor = executor;
    }

    /**
     * @return one record per distinct id, in request order
     */
    public Map<String, IncidentRecord> resolve(Collection<String> incidentIds, Instant deadline) {
        Set<String> pending = new LinkedHashSet<>(incidentIds);
        Map<String, IncidentRecord> found = new LinkedHashMap<>();

        if (graph != null && !pending.isEmpty() && !CollaboratorCalls.expired(deadline)) {
            List<String> ids = List.copyOf(pending);
            List<Map<String, Object>> rows = CollaboratorCalls.await("Graph incident lookup",
                    () -> graph.executeQuery(FETCH_QUERY, Map.of("incident_ids", ids)),
                    executor, linkage.getCollaboratorTimeout(), deadline, List.of());
            for (Map<String, Object> row : rows) {
                accept(node(row.get("i")), pending, found);
            }
        }

        if (search != null && !pending.isEmpty() && !CollaboratorCalls.expired(deadline)) {
            List<String> ids = List.copyOf(pending);
            Map<String, Object> query = Map.of("query", Map.of("terms", Map.of("incident_id", ids)));
            List<SearchHit> hits = CollaboratorCalls.await("Search incident lookup",
                    () -> search.search(linkage.getSearchIndex(), query, ids.size()),
                    executor, linkage.getCollaboratorTimeout(), deadline, List.of());
            for (SearchHit hit : hits) {
                accept(hit.source(), pending, found);
            }
        }

        if (!pending.isEmpty()) {
            log.debug("No record for {} incident(s), using placeholders: {}", pending.size(), pending);
        }

        Map<String, IncidentRecord> resolved = new LinkedHashMap<>();
        for (String id : new LinkedHashSet<>(incidentIds)) {
            IncidentRecord record = found.get(id);
            resolved.put(id, record != null ? record : IncidentRecord.placeholder(id));
        }
        return resolved;
    }

    /**
     * The lookup matches nodes on incident_id or id, so either key may be the
     * one that was asked for. The record is filed under the requested id.
     */
    private void accept(Map<String, Object> raw, Set<String> pending, Map<String, IncidentRecord> found) {
        if (raw == null) return;
        String requested = matchPending(raw, pending);
        if (requested == null) return;

        IncidentRecord record;
        try {
            record = mapper.map(raw);
        } catch (RuntimeException e) {
            log.warn("Could not map incident {}: {}", requested, e.getMessage());
            return;
        }
        if (record == null) return;

        pending.remove(requested);
        found.put(requested, requested.equals(record.getIncidentId())
                ? record
                : record.toBuilder().incidentId(requested).build());
    }

    private static String matchPending(Map<String, Object> raw, Set<String> pending) {
        for (String key : ID_KEYS) {
            Object value = raw.get(key);
            if (value != null && pending.contains(value.toString().trim())) {
                return value.toString().trim();
            }
        }
        return null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> node(Object value) {
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : null;
    }
}

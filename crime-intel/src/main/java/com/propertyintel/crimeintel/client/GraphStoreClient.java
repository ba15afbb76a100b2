package com.propertyintel.crimeintel.client;

import java.util.List;
import java.util.Map;

/**
 * Query access to the incident/entity graph.
 */
public interface GraphStoreClient {

    /**
     * Run a read query and return its rows keyed by column name.
     *
     * @param query  Cypher text
     * @param params named parameters referenced by the query
     * @return rows, possibly empty, never null
     * @throws CollaboratorException if the store cannot be reached or rejects the query
     */
    List<Map<String, Object>> executeQuery(String query, Map<String, Object> params);
}

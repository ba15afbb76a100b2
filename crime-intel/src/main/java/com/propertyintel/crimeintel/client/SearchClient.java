package com.propertyintel.crimeintel.client;

import java.util.List;
import java.util.Map;

/**
 * Relevance search over the incident text index.
 */
public interface SearchClient {

    /**
     * @param index index name, e.g. "incidents"
     * @param query query DSL body without the size
     * @param size  maximum number of hits
     * @return hits in relevance order, possibly empty, never null
     * @throws CollaboratorException if the index cannot be reached or rejects the query
     */
    List<SearchHit> search(String index, Map<String, Object> query, int size);
}

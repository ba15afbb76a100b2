package com.propertyintel.crimeintel.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Graph store client over the Neo4j transactional HTTP endpoint.
 *
 * Each query runs in its own auto-commit transaction:
 *   POST {base-url}/db/{database}/tx/commit
 *   {"statements":[{"statement": "...", "parameters": {...}}]}
 *
 * Nodes come back as their property maps, so {@code RETURN i} yields a row
 * whose "i" column is a Map of the incident's properties.
 *
 * Transport failures raise {@link CollaboratorException} and are retried;
 * statement errors raise {@link GraphQueryRejectedException} and are not.
 */
@Component
@ConditionalOnProperty(prefix = "crime-intel.graph", name = "enabled", havingValue = "true")
@Slf4j
public class Neo4jHttpGraphClient implements GraphStoreClient {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String commitPath;

    @Autowired
    public Neo4jHttpGraphClient(RestTemplateBuilder builder, ObjectMapper objectMapper, CrimeIntelProperties properties) {
        this(builder
                        .rootUri(properties.getGraph().getBaseUrl())
                        .basicAuthentication(properties.getGraph().getUsername(), properties.getGraph().getPassword())
                        .setConnectTimeout(properties.getGraph().getConnectTimeout())
                        .setReadTimeout(properties.getGraph().getReadTimeout())
                        .build(),
                objectMapper,
                properties.getGraph().getDatabase());
    }

    Neo4jHttpGraphClient(RestTemplate restTemplate, ObjectMapper objectMapper, String database) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.commitPath = "/db/" + database + "/tx/commit";
    }

    @Override
    @Retry(name = "graphStore")
    public List<Map<String, Object>> executeQuery(String query, Map<String, Object> params) {
        Map<String, Object> statement = new LinkedHashMap<>();
        statement.put("statement", query);
        statement.put("parameters", params == null ? Map.of() : params);
        Map<String, Object> body = Map.of("statements", List.of(statement));

        JsonNode response;
        try {
            response = restTemplate.postForObject(commitPath, body, JsonNode.class);
        } catch (RestClientException e) {
            throw new CollaboratorException("Graph query failed: " + e.getMessage(), e);
        }
        if (response == null) return List.of();

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            JsonNode first = errors.get(0);
            throw new GraphQueryRejectedException(first.path("code").asText(), first.path("message").asText());
        }

        JsonNode results = response.path("results");
        if (!results.isArray() || results.isEmpty()) return List.of();

        JsonNode result = results.get(0);
        List<String> columns = new ArrayList<>();
        result.path("columns").forEach(c -> columns.add(c.asText()));

        List<Map<String, Object>> rows = new ArrayList<>();
        for (JsonNode data : result.path("data")) {
            JsonNode row = data.path("row");
            Map<String, Object> mapped = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                JsonNode cell = row.get(i);
                mapped.put(columns.get(i), cell == null || cell.isNull()
                        ? null
                        : objectMapper.convertValue(cell, Object.class));
            }
            rows.add(mapped);
        }

        log.debug("Graph query returned {} rows", rows.size());
        return rows;
    }
}

package com.propertyintel.crimeintel.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.crimeintel.config.CrimeIntelProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Search client over the Elasticsearch/OpenSearch REST API.
 *
 *   POST {base-url}/{index}/_search
 *
 * A missing index (404) is treated as no hits; anything else that fails is
 * raised as a {@link CollaboratorException} after the Resilience4j retries.
 */
@Component
@ConditionalOnProperty(prefix = "crime-intel.search", name = "enabled", havingValue = "true")
@Slf4j
public class ElasticsearchSearchClient implements SearchClient {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public ElasticsearchSearchClient(RestTemplateBuilder builder, ObjectMapper objectMapper, CrimeIntelProperties properties) {
        this(configure(builder, properties.getSearch()), objectMapper);
    }

    ElasticsearchSearchClient(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    @Retry(name = "searchIndex")
    public List<SearchHit> search(String index, Map<String, Object> query, int size) {
        Map<String, Object> body = new LinkedHashMap<>(query);
        body.put("size", size);

        JsonNode response;
        try {
            response = restTemplate.postForObject("/{index}/_search", body, JsonNode.class, index);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Index {} not found, no hits", index);
            return Collections.emptyList();
        } catch (RestClientException e) {
            throw new CollaboratorException("Search on " + index + " failed: " + e.getMessage(), e);
        }
        if (response == null) return Collections.emptyList();

        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode hit : response.path("hits").path("hits")) {
            Map<String, Object> source = hit.hasNonNull("_source")
                    ? objectMapper.convertValue(hit.get("_source"), MAP_TYPE)
                    : Map.of();
            hits.add(new SearchHit(hit.path("_id").asText(null), hit.path("_score").asDouble(0.0), source));
        }

        log.debug("Search on {} returned {} hits", index, hits.size());
        return hits;
    }

    private static RestTemplate configure(RestTemplateBuilder builder, CrimeIntelProperties.Search config) {
        RestTemplateBuilder configured = builder
                .rootUri(config.getBaseUrl())
                .setConnectTimeout(config.getConnectTimeout())
                .setReadTimeout(config.getReadTimeout());
        if (config.getUsername() != null && !config.getUsername().isBlank()) {
            configured = configured.basicAuthentication(config.getUsername(), config.getPassword());
        }
        return configured.build();
    }
}

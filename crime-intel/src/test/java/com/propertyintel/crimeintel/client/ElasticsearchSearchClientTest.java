package com.propertyintel.crimeintel.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ElasticsearchSearchClientTest {

    private MockRestServiceServer server;
    private ElasticsearchSearchClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri("http://search.test").build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new ElasticsearchSearchClient(restTemplate, new ObjectMapper());
    }

    @Test
    void postsQueryWithSizeAndMapsHits() {
        server.expect(requestTo("http://search.test/incidents/_search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.size").value(10))
                .andExpect(jsonPath("$.query.term.incident_type").value("burglary"))
                .andRespond(withSuccess("""
                        {"hits":{"total":{"value":2},"hits":[
                            {"_id":"a1","_score":7.5,"_source":{"incident_id":"INC-7","summary":"Break-in"}},
                            {"_id":"a2","_source":{"incident_id":"INC-8"}}
                        ]}}
                        """, MediaType.APPLICATION_JSON));

        List<SearchHit> hits = client.search("incidents",
                Map.of("query", Map.of("term", Map.of("incident_type", "burglary"))), 10);

        assertThat(hits).hasSize(2);
        assertThat(hits.get(0).id()).isEqualTo("a1");
        assertThat(hits.get(0).score()).isEqualTo(7.5);
        assertThat(hits.get(0).sourceText("incident_id")).isEqualTo("INC-7");
        assertThat(hits.get(1).score()).isZero();
        server.verify();
    }

    @Test
    void missingIndexMeansNoHits() {
        server.expect(requestTo("http://search.test/incidents/_search")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(client.search("incidents", Map.of(), 5)).isEmpty();
    }

    @Test
    void otherFailuresAreRaised() {
        server.expect(requestTo("http://search.test/incidents/_search"))
                .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> client.search("incidents", Map.of(), 5))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("incidents");
    }
}

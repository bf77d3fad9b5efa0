package com.scalebee.service.prometheus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.model.MetricRow;
import com.scalebee.core.query.QueryResultParser;
import com.scalebee.core.spi.MetricsStore;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Prometheus HTTP API client. The {@link RestTemplate} carries the server root URI and timeouts;
 * queries go to {@code /api/v1/query}, readiness to {@code /-/ready}.
 */
@Slf4j
public class PrometheusMetricsStore implements MetricsStore {

    static final String QUERY_PATH = "/api/v1/query?query={query}";
    static final String READY_PATH = "/-/ready";

    private final RestTemplate restTemplate;
    private final ObjectMapper mapper;

    public PrometheusMetricsStore(RestTemplate restTemplate, ObjectMapper mapper) {
        this.restTemplate = restTemplate;
        this.mapper = mapper;
    }

    @Override
    public List<MetricRow> query(String expression) {
        String body;
        try {
            body = restTemplate.getForObject(QUERY_PATH, String.class, Map.of("query", expression));
        } catch (HttpStatusCodeException ex) {
            // Prometheus answers 4xx/5xx with the same envelope and an error text
            throw new MetricsStoreException(
                    "Query '" + expression + "' failed with HTTP " + ex.getStatusCode().value() + ": "
                            + errorText(ex.getResponseBodyAsString()),
                    ex);
        } catch (RestClientException ex) {
            throw new MetricsStoreException("Query '" + expression + "' failed: " + ex.getMessage(), ex);
        }
        try {
            return QueryResultParser.parse(readTree(body));
        } catch (MetricsStoreException ex) {
            throw new MetricsStoreException("Query '" + expression + "': " + ex.getMessage(), ex);
        }
    }

    @Override
    public boolean isReady() {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(READY_PATH, String.class);
            return response.getStatusCode().is2xxSuccessful();
        } catch (RestClientException ex) {
            log.debug("Readiness check failed: {}", ex.getMessage());
            return false;
        }
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException ex) {
            throw new MetricsStoreException("Unreadable query response: " + ex.getOriginalMessage(), ex);
        }
    }

    private String errorText(String body) {
        try {
            JsonNode error = readTree(body);
            if (error != null && error.hasNonNull("error")) {
                return error.get("error").asText();
            }
        } catch (MetricsStoreException ex) {
            log.debug("Error response is not JSON: {}", ex.getMessage());
        }
        return body == null || body.isBlank() ? "<empty body>" : body;
    }
}

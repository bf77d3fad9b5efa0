package com.scalebee.service.prometheus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.model.MetricRow;
import com.scalebee.core.query.AggregationQueries;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.hamcrest.Matchers;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class PrometheusMetricsStoreTest {

    private static final String ROOT = "http://prometheus:9090";

    private MockRestServiceServer server;
    private PrometheusMetricsStore store;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateBuilder().rootUri(ROOT).build();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        store = new PrometheusMetricsStore(restTemplate, new ObjectMapper());
    }

    @Test
    void sendsExpressionAsQueryParameter() {
        server.expect(requestTo(Matchers.startsWith(ROOT + "/api/v1/query?query=")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(request -> assertThat(URLDecoder.decode(request.getURI().getRawQuery(), StandardCharsets.UTF_8))
                        .isEqualTo("query=" + AggregationQueries.MEAN_CPU_BY_WORKLOAD))
                .andRespond(withSuccess(
                        "{\"status\":\"success\",\"data\":{\"resultType\":\"vector\",\"result\":["
                                + "{\"metric\":{\"service\":\"web\"},\"value\":[1714557600.1,\"92.5\"]}]}}",
                        MediaType.APPLICATION_JSON));

        List<MetricRow> rows = store.query(AggregationQueries.MEAN_CPU_BY_WORKLOAD);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).label("service")).contains("web");
        assertThat(rows.get(0).numericValue()).contains(92.5);
        server.verify();
    }

    @Test
    void badRequestCarriesPrometheusError() {
        server.expect(requestTo(Matchers.startsWith(ROOT + "/api/v1/query")))
                .andRespond(withStatus(HttpStatus.BAD_REQUEST)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"unexpected end of input\"}"));

        assertThatThrownBy(() -> store.query("avg("))
                .isInstanceOf(MetricsStoreException.class)
                .hasMessageContaining("HTTP 400")
                .hasMessageContaining("unexpected end of input");
    }

    @Test
    void unreachableStoreFailsQuery() {
        server.expect(requestTo(Matchers.startsWith(ROOT + "/api/v1/query")))
                .andRespond(withException(new IOException("connection refused")));

        assertThatThrownBy(() -> store.query(AggregationQueries.MEAN_CPU_BY_WORKLOAD))
                .isInstanceOf(MetricsStoreException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void unreadableBodyFailsQuery() {
        server.expect(requestTo(Matchers.startsWith(ROOT + "/api/v1/query")))
                .andRespond(withSuccess("<html>proxy error</html>", MediaType.TEXT_HTML));

        assertThatThrownBy(() -> store.query(AggregationQueries.MEAN_CPU_BY_WORKLOAD))
                .isInstanceOf(MetricsStoreException.class);
    }

    @Test
    void readyOn2xx() {
        server.expect(requestTo(ROOT + "/-/ready")).andRespond(withSuccess("Prometheus Server is Ready.", MediaType.TEXT_PLAIN));

        assertThat(store.isReady()).isTrue();
    }

    @Test
    void notReadyOnErrorOrConnectionFailure() {
        server.expect(requestTo(ROOT + "/-/ready")).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));
        server.expect(requestTo(ROOT + "/-/ready")).andRespond(withException(new IOException("connection refused")));

        assertThat(store.isReady()).isFalse();
        assertThat(store.isReady()).isFalse();
    }
}

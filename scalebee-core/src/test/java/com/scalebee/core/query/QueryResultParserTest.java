package com.scalebee.core.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.model.MetricRow;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QueryResultParserTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void parsesVectorResult() throws Exception {
        List<MetricRow> rows = QueryResultParser.parse(json(
                """
                {"status":"success","data":{"resultType":"vector","result":[
                  {"metric":{"service":"web"},"value":[1700000000.5,"92.5"]},
                  {"metric":{"service":"api"},"value":[1700000000.5,"10"]}
                ]}}
                """));

        assertEquals(2, rows.size());
        assertThat(rows.get(0).label("service")).contains("web");
        assertThat(rows.get(0).numericValue()).contains(92.5);
    }

    @Test
    void emptyResultIsNotAnError() throws Exception {
        List<MetricRow> rows = QueryResultParser.parse(json("{\"status\":\"success\",\"data\":{\"result\":[]}}"));

        assertThat(rows).isEmpty();
    }

    @Test
    void failedStatusCarriesErrorText() throws Exception {
        JsonNode body = json("{\"status\":\"error\",\"errorType\":\"bad_data\",\"error\":\"parse error at char 4\"}");

        assertThatThrownBy(() -> QueryResultParser.parse(body))
                .isInstanceOf(MetricsStoreException.class)
                .hasMessageContaining("error")
                .hasMessageContaining("parse error at char 4");
    }

    @Test
    void missingResultArrayFails() throws Exception {
        JsonNode body = json("{\"status\":\"success\",\"data\":{}}");

        assertThatThrownBy(() -> QueryResultParser.parse(body)).isInstanceOf(MetricsStoreException.class);
        assertThatThrownBy(() -> QueryResultParser.parse(null)).isInstanceOf(MetricsStoreException.class);
    }

    @Test
    void meanByLabelDropsUnusableRows() throws Exception {
        List<MetricRow> rows = QueryResultParser.parse(json(
                """
                {"status":"success","data":{"result":[
                  {"metric":{"service":"web"},"value":[1,"40"]},
                  {"metric":{},"value":[1,"99"]},
                  {"metric":{"service":"api"},"value":[1,"NaN"]},
                  {"metric":{"service":"db"},"value":[1]},
                  {"metric":{"service":"cache"},"value":[1,"not-a-number"]}
                ]}}
                """));

        Map<String, Double> means = QueryResultParser.meanByLabel(rows, AggregationQueries.WORKLOAD_LABEL);

        assertThat(means).containsOnly(Map.entry("web", 40.0));
    }

    @Test
    void meanByLabelAveragesDuplicates() {
        List<MetricRow> rows = List.of(
                new MetricRow(Map.of("service", "web"), List.of("1", "30")),
                new MetricRow(Map.of("service", "web"), List.of("1", "50")),
                new MetricRow(Map.of("service", "api"), List.of("1", "5")));

        Map<String, Double> means = QueryResultParser.meanByLabel(rows, "service");

        assertThat(means).containsExactly(Map.entry("api", 5.0), Map.entry("web", 40.0));
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }
}

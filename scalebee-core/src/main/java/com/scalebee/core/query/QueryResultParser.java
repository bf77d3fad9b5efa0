package com.scalebee.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.model.MetricRow;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the body of an instant query ({@code {"status":"success","data":{"result":[...]}}}) into
 * rows and reduces rows to per-label values. Malformed rows are dropped; only a failed status or a
 * body without a result array fails the whole query.
 */
public final class QueryResultParser {

    private static final String STATUS_SUCCESS = "success";

    private QueryResultParser() {}

    public static List<MetricRow> parse(JsonNode body) {
        if (body == null || body.isMissingNode() || body.isNull()) {
            throw new MetricsStoreException("Empty query response");
        }
        String status = body.path("status").asText("");
        if (!STATUS_SUCCESS.equals(status)) {
            String error = body.path("error").asText("");
            throw new MetricsStoreException(
                    "Query failed with status '" + status + "'" + (error.isEmpty() ? "" : ": " + error));
        }
        JsonNode result = body.path("data").path("result");
        if (!result.isArray()) {
            throw new MetricsStoreException("Query response has no result array");
        }
        List<MetricRow> rows = new ArrayList<>(result.size());
        for (JsonNode entry : result) {
            rows.add(new MetricRow(labels(entry.path("metric")), values(entry.path("value"))));
        }
        return rows;
    }

    /**
     * Groups rows by {@code label} and averages their values. Rows without the label or without a
     * usable value are skipped.
     */
    public static Map<String, Double> meanByLabel(List<MetricRow> rows, String label) {
        Map<String, double[]> sums = new TreeMap<>();
        for (MetricRow row : rows) {
            String key = row.label(label).orElse(null);
            if (key == null) {
                continue;
            }
            row.numericValue().ifPresent(v -> {
                double[] acc = sums.computeIfAbsent(key, k -> new double[2]);
                acc[0] += v;
                acc[1]++;
            });
        }
        Map<String, Double> means = new LinkedHashMap<>();
        sums.forEach((key, acc) -> means.put(key, acc[0] / acc[1]));
        return means;
    }

    private static Map<String, String> labels(JsonNode metric) {
        Map<String, String> labels = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = metric.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            labels.put(field.getKey(), field.getValue().asText());
        }
        return labels;
    }

    private static List<String> values(JsonNode value) {
        List<String> values = new ArrayList<>();
        if (value.isArray()) {
            value.forEach(v -> values.add(v.asText()));
        }
        return values;
    }
}

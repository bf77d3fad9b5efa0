package com.scalebee.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricRowTest {

    @Test
    void parsesSecondElementAsValue() {
        MetricRow row = new MetricRow(Map.of("service", "web"), List.of("1700000000.123", "42.5"));

        assertThat(row.numericValue()).contains(42.5);
        assertThat(row.label("service")).contains("web");
        assertThat(row.label("task")).isEmpty();
    }

    @Test
    void incompleteOrNonNumericValuesAreEmpty() {
        assertThat(new MetricRow(Map.of(), List.of("1700000000")).numericValue()).isEmpty();
        assertThat(new MetricRow(Map.of(), List.of("1700000000", "abc")).numericValue()).isEmpty();
        assertThat(new MetricRow(Map.of(), List.of("1700000000", "NaN")).numericValue()).isEmpty();
        assertThat(new MetricRow(Map.of(), List.of("1700000000", "+Inf")).numericValue()).isEmpty();
        assertThat(new MetricRow(null, null).numericValue()).isEmpty();
    }
}

package com.scalebee.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One row of an instant query result: a label set and the {@code [timestamp, value]} pair, both
 * elements kept as the text the store returned.
 */
public record MetricRow(Map<String, String> labels, List<String> value) {

    public MetricRow {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        value = value == null ? List.of() : List.copyOf(value);
    }

    public Optional<String> label(String name) {
        return Optional.ofNullable(labels.get(name));
    }

    /** Empty when the pair is incomplete or the value is not a finite number. */
    public Optional<Double> numericValue() {
        if (value.size() < 2) {
            return Optional.empty();
        }
        try {
            double parsed = Double.parseDouble(value.get(1));
            return Double.isFinite(parsed) ? Optional.of(parsed) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }
}

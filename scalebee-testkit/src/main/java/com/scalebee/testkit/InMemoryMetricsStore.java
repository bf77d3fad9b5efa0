package com.scalebee.testkit;

import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.model.MetricRow;
import com.scalebee.core.spi.MetricsStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/** Test double that answers fixed rows per expression and records the queries it saw. */
public class InMemoryMetricsStore implements MetricsStore {

    private final Map<String, List<MetricRow>> results = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final List<String> queries = Collections.synchronizedList(new ArrayList<>());
    private final AtomicInteger readyChecks = new AtomicInteger();
    private volatile int readyAfter;

    public synchronized InMemoryMetricsStore answer(String expression, List<MetricRow> rows) {
        results.put(expression, List.copyOf(rows));
        failures.remove(expression);
        return this;
    }

    /** Convenience for the common single-label case: {@code label=value} rows with one sample each. */
    public InMemoryMetricsStore answer(String expression, String label, Map<String, Double> values) {
        List<MetricRow> rows = new ArrayList<>();
        values.forEach((key, value) -> rows.add(new MetricRow(Map.of(label, key), List.of("0", Double.toString(value)))));
        return answer(expression, rows);
    }

    public synchronized InMemoryMetricsStore fail(String expression, String message) {
        failures.put(expression, message);
        return this;
    }

    /** The store reports not ready for the first {@code checks} readiness checks. */
    public InMemoryMetricsStore readyAfter(int checks) {
        readyAfter = checks;
        return this;
    }

    @Override
    public List<MetricRow> query(String expression) {
        queries.add(expression);
        synchronized (this) {
            String failure = failures.get(expression);
            if (failure != null) {
                throw new MetricsStoreException(failure);
            }
            return results.getOrDefault(expression, List.of());
        }
    }

    @Override
    public boolean isReady() {
        return readyChecks.incrementAndGet() > readyAfter;
    }

    public List<String> queries() {
        synchronized (queries) {
            return List.copyOf(queries);
        }
    }

    public int readyChecks() {
        return readyChecks.get();
    }
}

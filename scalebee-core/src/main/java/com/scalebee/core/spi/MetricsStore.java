package com.scalebee.core.spi;

import com.scalebee.core.model.MetricRow;
import java.util.List;

/** Time-series store that scrapes the published samples and answers instant queries. */
public interface MetricsStore {

    /**
     * Runs an instant query.
     *
     * @throws com.scalebee.core.exception.MetricsStoreException if the store cannot be reached or
     *     rejects the query
     */
    List<MetricRow> query(String expression);

    /** True once the store reports ready. Never throws. */
    boolean isReady();
}

package com.scalebee.core.readiness;

import com.scalebee.core.exception.MetricsStoreException;
import com.scalebee.core.spi.MetricsStore;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocks until the metrics store reports ready. Between attempts it waits 2, 4, 8, ... seconds,
 * capped at {@code maxBackoff}.
 */
public class MetricsStoreReadiness {

    private static final Logger log = LoggerFactory.getLogger(MetricsStoreReadiness.class);

    private final MetricsStore store;
    private final int maxAttempts;
    private final Duration maxBackoff;
    private final Sleeper sleeper;

    public MetricsStoreReadiness(MetricsStore store, int maxAttempts, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        this.store = Objects.requireNonNull(store, "store");
        this.maxAttempts = maxAttempts;
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * @throws MetricsStoreException if the store is not ready after the last attempt
     * @throws InterruptedException if interrupted while waiting between attempts
     */
    public void awaitReady() throws InterruptedException {
        log.info("Waiting for the metrics store to be ready...");
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (store.isReady()) {
                log.info("Metrics store is ready");
                return;
            }
            if (attempt < maxAttempts) {
                Duration wait = backoff(attempt);
                log.info(
                        "Metrics store not ready (attempt {}/{}), retrying in {}s",
                        attempt,
                        maxAttempts,
                        wait.toSeconds());
                sleeper.sleep(wait);
            }
        }
        throw new MetricsStoreException("Metrics store did not become ready after " + maxAttempts + " attempts");
    }

    Duration backoff(int attempt) {
        Duration exponential = Duration.ofSeconds(1L << Math.min(attempt, 30));
        return exponential.compareTo(maxBackoff) > 0 ? maxBackoff : exponential;
    }
}

package com.scalebee.core.readiness;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Sleeper tied to a single stop signal. {@link #cancel()} wakes every current sleeper and makes
 * later calls fail immediately, so a shutdown never waits out a backoff.
 */
public class CancellableSleeper implements Sleeper {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public void sleep(Duration duration) throws InterruptedException {
        if (cancelled.await(duration.toMillis(), TimeUnit.MILLISECONDS)) {
            throw new InterruptedException("Wait cancelled");
        }
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}

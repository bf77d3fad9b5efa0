package com.scalebee.core.readiness;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {

    /** Waits for {@code duration}; throws once waiting is cancelled or the thread is interrupted. */
    void sleep(Duration duration) throws InterruptedException;
}

package com.demo.retryengine.retry;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Waits between attempts of a blocking execute call. Must respond to interruption.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos());

    void sleep(Duration delay) throws InterruptedException;
}

package com.enterprise.taskrouting.retry;

import java.time.Duration;

/**
 * Backoff sleep, replaceable in tests
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

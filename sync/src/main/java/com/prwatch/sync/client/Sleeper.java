package com.prwatch.sync.client;

import java.time.Duration;

/**
 * Blocking pause used for rate-limit waits. Tests substitute a recording
 * implementation.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

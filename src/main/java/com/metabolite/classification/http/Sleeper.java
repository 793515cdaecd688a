package com.metabolite.classification.http;

import java.time.Duration;

/**
 * Blocking pause, swappable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());
}

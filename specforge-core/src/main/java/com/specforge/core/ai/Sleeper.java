package com.specforge.core.ai;

import java.time.Duration;

/**
 * Waits between retry attempts. Replaced in tests to avoid real delays.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

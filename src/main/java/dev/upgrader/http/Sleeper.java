package dev.upgrader.http;

import java.time.Duration;

/**
 * Pause between retry attempts; swapped out in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}

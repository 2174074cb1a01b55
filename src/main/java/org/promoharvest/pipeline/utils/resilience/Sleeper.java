package org.promoharvest.pipeline.utils.resilience;

/**
 * Blocking pause used by the rate limiter and retrier; replaced by a clock-advancing fake in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}

package com.obelisk.registry;

import java.time.Duration;

/** Waits between retry attempts. */
@FunctionalInterface
public interface Backoff {

    Backoff SLEEP = delay -> Thread.sleep(delay.toMillis());

    void await(Duration delay) throws InterruptedException;
}

package com.basketbot.service.scheduling;

import java.time.Duration;

/**
 * Pause between order placements. Unlike {@link Ticker} it ignores shutdown so a basket
 * that has started is placed to the end or stopped by a rejection, never cut mid-way.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper threadSleep() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}

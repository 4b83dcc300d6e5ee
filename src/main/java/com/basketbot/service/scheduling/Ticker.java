package com.basketbot.service.scheduling;

import java.time.Duration;

/**
 * Cancellable pause between loop iterations.
 */
public interface Ticker {

    /**
     * Waits for {@code interval} or until cancelled.
     *
     * @return true if the full interval elapsed, false if the ticker was cancelled
     */
    boolean await(Duration interval);

    void cancel();

    boolean isCancelled();
}

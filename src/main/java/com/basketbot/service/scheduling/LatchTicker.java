package com.basketbot.service.scheduling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock {@link Ticker}. {@link #cancel()} releases any waiting thread immediately
 * and every later {@link #await(Duration)} returns false without sleeping.
 */
@Slf4j
public class LatchTicker implements Ticker {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    @Override
    public boolean await(Duration interval) {
        try {
            return !cancelled.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Ticker interrupted, treating as cancellation");
            cancel();
            return false;
        }
    }

    @Override
    public void cancel() {
        cancelled.countDown();
    }

    @Override
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }
}

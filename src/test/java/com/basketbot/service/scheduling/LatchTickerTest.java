package com.basketbot.service.scheduling;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LatchTickerTest {

    @Test
    void awaitElapsesWhenNotCancelled() {
        LatchTicker ticker = new LatchTicker();
        assertTrue(ticker.await(Duration.ofMillis(10)));
        assertFalse(ticker.isCancelled());
    }

    @Test
    void cancelReleasesWaitingThread() throws Exception {
        LatchTicker ticker = new LatchTicker();
        CompletableFuture<Boolean> waiting = CompletableFuture.supplyAsync(() -> ticker.await(Duration.ofMinutes(5)));

        Thread.sleep(50);
        ticker.cancel();

        assertFalse(waiting.get(5, TimeUnit.SECONDS));
        assertTrue(ticker.isCancelled());
        assertFalse(ticker.await(Duration.ofMinutes(5)));
    }
}

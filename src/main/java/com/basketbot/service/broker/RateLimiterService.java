package com.basketbot.service.broker;

import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.EnumMap;
import java.util.Map;

/**
 * Client-side throttle for Kite Connect calls.
 *
 * Kite allows 10 requests per second per API key overall and a lower rate per endpoint
 * family (orders are limited separately from quotes). Each family and the global budget
 * are tracked with a sliding one-second window; a caller blocks until both have room or
 * the acquire timeout passes.
 *
 * @see <a href="https://kite.trade/docs/connect/v3/exceptions/">Kite API Rate Limits</a>
 */
@Slf4j
public class RateLimiterService {

    private static final int PER_API_LIMIT = 3;
    private static final int GLOBAL_LIMIT = 10;
    private static final long WINDOW_MS = 1000;
    private static final long DEFAULT_ACQUIRE_TIMEOUT_MS = 5000;
    private static final long RETRY_PAUSE_MS = 50;

    public enum ApiType {
        QUOTE,          // getLTP, getQuote
        ORDER,          // placeOrder
        INSTRUMENTS,    // getInstruments
        HISTORICAL,     // getHistoricalData
        POSITIONS,      // getPositions
        MARGINS,        // getMargins
        PROFILE         // getProfile
    }

    private final Map<ApiType, SlidingWindow> apiWindows = new EnumMap<>(ApiType.class);
    private final SlidingWindow globalWindow;
    private final long acquireTimeoutMs;

    public RateLimiterService() {
        this(DEFAULT_ACQUIRE_TIMEOUT_MS);
    }

    public RateLimiterService(long acquireTimeoutMs) {
        this.acquireTimeoutMs = acquireTimeoutMs;
        this.globalWindow = new SlidingWindow(GLOBAL_LIMIT, WINDOW_MS);
        for (ApiType type : ApiType.values()) {
            apiWindows.put(type, new SlidingWindow(PER_API_LIMIT, WINDOW_MS));
        }
        log.info("RateLimiterService initialized with per-API limit: {}/sec, global limit: {}/sec",
                PER_API_LIMIT, GLOBAL_LIMIT);
    }

    /**
     * Blocks until a permit for {@code apiType} is available.
     *
     * @return false if the timeout passed or the thread was interrupted
     */
    public boolean acquire(ApiType apiType) {
        long startTime = System.currentTimeMillis();
        long deadline = startTime + acquireTimeoutMs;

        try {
            while (true) {
                if (tryAcquire(apiType)) {
                    if (log.isDebugEnabled()) {
                        log.debug("Rate limit permit acquired for {} in {}ms",
                                apiType, System.currentTimeMillis() - startTime);
                    }
                    return true;
                }
                long remaining = deadline - System.currentTimeMillis();
                if (remaining <= 0) {
                    break;
                }
                Thread.sleep(Math.min(RETRY_PAUSE_MS, remaining));
            }
            log.warn("Rate limit timeout after {}ms for API type: {}", acquireTimeoutMs, apiType);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Rate limit acquisition interrupted for API type: {}", apiType);
            return false;
        }
    }

    boolean tryAcquire(ApiType apiType) {
        synchronized (globalWindow) {
            SlidingWindow apiWindow = apiWindows.get(apiType);
            long now = System.currentTimeMillis();
            if (globalWindow.hasRoom(now) && apiWindow.hasRoom(now)) {
                globalWindow.record(now);
                apiWindow.record(now);
                return true;
            }
            return false;
        }
    }

    /**
     * Runs a Kite call once a permit is available.
     *
     * @throws RateLimitExceededException if no permit could be acquired; the call was not made
     */
    public <T> T call(ApiType apiType, KiteCall<T> kiteCall) throws KiteException, IOException {
        if (!acquire(apiType)) {
            throw new RateLimitExceededException(
                    "Rate limit exceeded for API type: " + apiType + ". Request was not sent.");
        }
        return kiteCall.execute();
    }

    /**
     * A Kite SDK call. {@link KiteException} is a {@link Throwable}, not an {@link Exception},
     * so it is declared explicitly.
     */
    @FunctionalInterface
    public interface KiteCall<T> {
        T execute() throws KiteException, IOException;
    }

    public static class RateLimitExceededException extends RuntimeException {
        public RateLimitExceededException(String message) {
            super(message);
        }
    }

    /**
     * Ring of the last {@code maxRequests} permit timestamps.
     */
    private static class SlidingWindow {
        private final long windowMs;
        private final long[] timestamps;
        private int next;

        SlidingWindow(int maxRequests, long windowMs) {
            this.windowMs = windowMs;
            this.timestamps = new long[maxRequests];
        }

        boolean hasRoom(long now) {
            // the slot about to be overwritten is the oldest one
            return timestamps[next] <= now - windowMs;
        }

        void record(long now) {
            timestamps[next] = now;
            next = (next + 1) % timestamps.length;
        }
    }
}

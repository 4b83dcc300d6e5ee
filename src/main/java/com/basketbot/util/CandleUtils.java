package com.basketbot.util;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Utility helpers for working with candle intervals.
 * Intraday candles are aligned to the session open (09:15 on NSE), not to the hour.
 */
@UtilityClass
public class CandleUtils {

    /**
     * Candle length for a resolution code: minutes as digits, or D for a session.
     */
    public static Duration resolutionDuration(String resolution) {
        if ("D".equals(resolution)) {
            return Duration.ofDays(1);
        }
        try {
            int minutes = Integer.parseInt(resolution);
            if (minutes <= 0) {
                throw new IllegalArgumentException("Resolution must be positive: " + resolution);
            }
            return Duration.ofMinutes(minutes);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown candle resolution: " + resolution, e);
        }
    }

    /**
     * Open time of the candle that contains {@code now}.
     *
     * @param now         reference timestamp (timezone already applied)
     * @param sessionOpen first candle open of the day
     * @param resolution  resolution code, see {@link #resolutionDuration(String)}
     */
    public static ZonedDateTime currentCandleOpen(ZonedDateTime now, LocalTime sessionOpen, String resolution) {
        if (now == null) {
            throw new IllegalArgumentException("now must not be null");
        }
        ZonedDateTime open = now.with(sessionOpen).truncatedTo(ChronoUnit.MINUTES);
        if ("D".equals(resolution) || now.isBefore(open)) {
            return open;
        }
        long candleMinutes = resolutionDuration(resolution).toMinutes();
        long elapsed = Duration.between(open, now).toMinutes();
        return open.plusMinutes((elapsed / candleMinutes) * candleMinutes);
    }

    /**
     * True if a candle opened at {@code candleOpenEpochSeconds} has closed by {@code now}.
     */
    public static boolean isClosed(long candleOpenEpochSeconds, String resolution, ZonedDateTime now) {
        long closeEpoch = candleOpenEpochSeconds + resolutionDuration(resolution).getSeconds();
        return closeEpoch <= now.toEpochSecond();
    }
}

package com.basketbot.util;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Relative Strength Index with Wilder smoothing.
 */
@UtilityClass
public class RsiCalculator {

    /**
     * RSI of the last close in {@code closes} (oldest first).
     * The first average is the simple mean of the first {@code period} changes; later values
     * are smoothed with factor 1/period.
     *
     * @return RSI in [0, 100], or NaN when fewer than {@code period + 1} closes are given
     */
    public static double wilderRsi(List<Double> closes, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1");
        }
        if (closes == null || closes.size() < period + 1) {
            return Double.NaN;
        }

        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum -= change;
            }
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;

        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            double gain = Math.max(change, 0.0);
            double loss = Math.max(-change, 0.0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
        }

        if (avgLoss == 0.0) {
            return avgGain == 0.0 ? 50.0 : 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}

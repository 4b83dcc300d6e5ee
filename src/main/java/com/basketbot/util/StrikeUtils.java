package com.basketbot.util;

import lombok.experimental.UtilityClass;

/**
 * Strike arithmetic on the exchange's strike grid.
 */
@UtilityClass
public class StrikeUtils {

    /**
     * Nearest listed strike to {@code spot}. Exact midpoints go to the even multiple of the
     * base, so 22,075 on a 50 grid is 22,100 and 22,025 is 22,000.
     */
    public static double atmStrike(double spot, int strikeBase) {
        if (strikeBase <= 0) {
            throw new IllegalArgumentException("strikeBase must be positive");
        }
        return Math.rint(spot / strikeBase) * strikeBase;
    }
}

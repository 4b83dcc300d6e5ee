package com.basketbot.model;

/**
 * Direction of a leg. The sign is used when deriving held exposure from net quantity.
 */
public enum Side {
    BUY(1),
    SELL(-1);

    private final int sign;

    Side(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    /**
     * Side implied by a signed net quantity. Callers must not pass zero.
     */
    public static Side fromNetQuantity(int netQuantity) {
        if (netQuantity == 0) {
            throw new IllegalArgumentException("Flat position has no side");
        }
        return netQuantity > 0 ? BUY : SELL;
    }
}

package com.basketbot.model;

/**
 * Basket shapes the engine knows how to build.
 */
public enum StrategyVariant {
    /** Configured legs at signed offsets from ATM, e.g. a 1:3:2 call ratio basket */
    OFFSET_BASKET,
    /** Call above and put below ATM at the same distance */
    STRANGLE
}

package com.basketbot.model;

/**
 * Reasons a monitored basket is closed.
 * Used both for the exit decision and for tagging closing orders.
 */
public enum ExitReason {

    /**
     * Aggregate P&L reached the configured profit target.
     */
    TARGET,

    /**
     * Aggregate P&L reached the configured loss limit.
     */
    STOP_LOSS,

    /**
     * Configured exit time or exchange close reached; positions are squared off to avoid
     * carrying them overnight.
     */
    MARKET_CLOSE,

    /**
     * Operator requested the exit through the API.
     */
    MANUAL,

    /**
     * No exit condition has been observed. Only returned when monitoring is cancelled.
     */
    NONE
}

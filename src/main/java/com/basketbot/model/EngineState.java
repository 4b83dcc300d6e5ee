package com.basketbot.model;

/**
 * Lifecycle states of the strategy engine for one trading day.
 */
public enum EngineState {
    /**
     * Waiting for the entry policy to allow a new basket
     */
    WAITING_ENTRY,

    /**
     * Basket legs are being placed
     */
    ENTERING,

    /**
     * Basket is open and P&L is being polled against target and stop-loss
     */
    MONITORING,

    /**
     * Closing orders are being placed
     */
    EXITING,

    /**
     * Basket closed for the day
     */
    DONE,

    /**
     * Entry was only partially filled; needs operator attention
     */
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}

package com.basketbot.model;

/**
 * Outcome of a single order placement as seen by the caller.
 */
public enum OrderStatus {
    /** Broker accepted the order and returned an id */
    ACCEPTED,
    /** Broker refused the order */
    REJECTED,
    /** Transport failed mid-request; the order may or may not exist at the broker */
    UNKNOWN
}

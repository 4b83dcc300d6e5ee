package com.basketbot.exception;

/**
 * Base type for failures reported by the broker gateway.
 */
public class BrokerException extends Exception {

    private final int code;

    public BrokerException(String message) {
        this(message, 0, null);
    }

    public BrokerException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public BrokerException(String message, int code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * Broker error code if one was returned, else 0.
     */
    public int getCode() {
        return code;
    }
}

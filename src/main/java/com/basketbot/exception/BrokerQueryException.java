package com.basketbot.exception;

/**
 * A quote, position, funds or instrument lookup failed or timed out. Transient: callers
 * skip the current tick and try again on the next one.
 */
public class BrokerQueryException extends BrokerException {

    public BrokerQueryException(String message) {
        super(message);
    }

    public BrokerQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public BrokerQueryException(String message, int code, Throwable cause) {
        super(message, code, cause);
    }
}

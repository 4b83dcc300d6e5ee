package com.basketbot.exception;

/**
 * Broker refused the configured credentials. Fatal at startup.
 */
public class BrokerAuthenticationException extends BrokerException {

    public BrokerAuthenticationException(String message, int code, Throwable cause) {
        super(message, code, cause);
    }
}

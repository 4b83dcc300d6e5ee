package com.basketbot.exception;

/**
 * Streaming transport could not be opened or used.
 */
public class StreamingException extends Exception {

    public StreamingException(String message) {
        super(message);
    }

    public StreamingException(String message, Throwable cause) {
        super(message, cause);
    }
}

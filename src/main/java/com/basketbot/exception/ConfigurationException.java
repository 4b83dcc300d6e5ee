package com.basketbot.exception;

/**
 * Missing or malformed startup input (token file, required key). Raised before any order
 * can be placed and stops the application.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

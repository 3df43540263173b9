package com.di.scorenova.exception;

/**
 * Thrown when a component is used before it has a usable configuration,
 * e.g. a lake write on a connector without workspace, container or credential.
 *
 * <p>Returned as 503 Service Unavailable by {@link GlobalExceptionHandler}.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

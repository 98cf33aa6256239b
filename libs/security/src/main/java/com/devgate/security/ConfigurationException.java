package com.devgate.security;

/**
 * Thrown when authentication settings are missing or invalid.
 * <p>
 * A configuration problem is never recoverable at request time: the server must refuse to
 * start rather than serve traffic with a half-configured validator. Messages name the
 * offending environment variable so operators can fix the deployment directly.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}

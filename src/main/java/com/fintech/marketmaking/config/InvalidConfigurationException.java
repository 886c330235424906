package com.fintech.marketmaking.config;

/**
 * Thrown when resolved security configuration violates a constraint.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }
}

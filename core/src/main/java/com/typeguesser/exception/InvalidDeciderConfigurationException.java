package com.typeguesser.exception;

/**
 * Thrown when a decider or decider registry is assembled incorrectly, for
 * example a decider claiming no supported scalar types.
 */
public class InvalidDeciderConfigurationException extends RuntimeException {

    public InvalidDeciderConfigurationException(String message) {
        super(message);
    }
}

package com.typeguesser.exception;

/**
 * Thrown when a hard-typed value's class has no registered decider.
 *
 * <p>This signals a configuration or programming gap rather than bad data.
 */
public class UnsupportedTypeException extends RuntimeException {

    private final Class<?> unsupportedType;

    public UnsupportedTypeException(Class<?> unsupportedType) {
        this(ErrorMessages.unsupportedType(unsupportedType), unsupportedType);
    }

    public UnsupportedTypeException(String message, Class<?> unsupportedType) {
        super(message);
        this.unsupportedType = unsupportedType;
    }

    /**
     * Returns the class that could not be mapped to a decider.
     *
     * @return the offending class
     */
    public Class<?> getUnsupportedType() {
        return unsupportedType;
    }
}

package com.typeguesser.exception;

import com.typeguesser.types.TypeTag;

/**
 * Thrown when a string cannot be parsed as the guessed type.
 *
 * <p>Every string a guesser accepted can be parsed after any further input,
 * so this exception indicates a string that was never validated through
 * ingestion, or a broken invariant. It is not a recoverable data condition.
 */
public class TypeParseException extends RuntimeException {

    private final String value;
    private final TypeTag targetType;

    public TypeParseException(String value, TypeTag targetType) {
        super(ErrorMessages.parseError(value, targetType));
        this.value = value;
        this.targetType = targetType;
    }

    /**
     * Returns the string that failed to parse.
     *
     * @return the rejected value
     */
    public String getValue() {
        return value;
    }

    public TypeTag getTargetType() {
        return targetType;
    }
}

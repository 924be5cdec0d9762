package com.typeguesser.exception;

import com.typeguesser.types.TypeTag;

/**
 * Thrown when two type estimates share no widening group and the caller has
 * not accepted a fallback to string.
 */
public class IncompatibleTypesException extends RuntimeException {

    private final TypeTag first;
    private final TypeTag second;

    public IncompatibleTypesException(TypeTag first, TypeTag second) {
        super(ErrorMessages.cannotCombineTypes(first, second));
        this.first = first;
        this.second = second;
    }

    public TypeTag getFirst() {
        return first;
    }

    public TypeTag getSecond() {
        return second;
    }
}

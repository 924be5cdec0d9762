package com.typeguesser.exception;

import com.typeguesser.types.TypeTag;

/**
 * Message formatters for the guesser's exceptions.
 *
 * <p>Only the exception types are part of the contract; wording may change.
 */
public final class ErrorMessages {

    private static final String REGIME_HINT =
        " A guesser must be fed either strings or hard-typed values, not both; reset it before switching.";

    private ErrorMessages() {}

    public static String unsupportedType(Class<?> type) {
        return "No type decider exists for type: " + (type == null ? "null" : type.getName());
    }

    public static String nonFiniteNumber(Object value) {
        return "Non-finite value '" + value + "' has no decimal representation";
    }

    public static String cannotCombineTypes(TypeTag first, TypeTag second) {
        return String.format(
            "Could not combine types '%s' and '%s': they share no widening group and string fallback was not allowed",
            first.typeName(), second.typeName());
    }

    public static String parseError(String value, TypeTag type) {
        return String.format("Could not parse '%s' as %s", value, type.typeName());
    }

    public static String integerAfterString() {
        return "Cannot process a hard-typed integer value after processing string values." + REGIME_HINT;
    }

    public static String decimalAfterString() {
        return "Cannot process a hard-typed decimal value after processing string values." + REGIME_HINT;
    }

    public static String booleanAfterString() {
        return "Cannot process a hard-typed boolean value after processing string values." + REGIME_HINT;
    }

    public static String hardTypedAfterString(Class<?> type) {
        return "Cannot process a hard-typed " + type.getName() + " value after processing string values." + REGIME_HINT;
    }

    public static String stringAfterHardTyped(TypeTag locked) {
        return "Cannot process string values after processing hard-typed values (locked to "
            + locked.typeName() + ")." + REGIME_HINT;
    }

    public static String hardTypedFamilyConflict(Class<?> type, TypeTag incoming, TypeTag locked) {
        return String.format(
            "Hard-typed %s value is a %s but the guesser was previously passed %s values",
            type.getName(), incoming.typeName(), locked.typeName());
    }

    public static String noScalarTypes(TypeTag type) {
        return "Type decider for " + type.typeName() + " was not given any supported scalar types";
    }
}

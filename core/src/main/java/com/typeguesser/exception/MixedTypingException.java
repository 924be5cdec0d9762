package com.typeguesser.exception;

/**
 * Thrown when strings and hard-typed values are mixed on one guesser, or when
 * hard-typed values of families that cannot merge are supplied.
 *
 * <p>The guesser's state is left exactly as it was before the failing call.
 * The {@link Kind} identifies the offending family so that callers can tell
 * misuse of a pooled instance apart from genuinely conflicting input.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       guesser.adjustToCompensateForValue(value);
 *   } catch (MixedTypingException e) {
 *       if (e.getKind() == MixedTypingException.Kind.STRING_AFTER_HARD_TYPED) {
 *           // caller fed text into a typed column
 *       }
 *   }
 * </pre>
 */
public class MixedTypingException extends RuntimeException {

    /**
     * Sub-kinds of mixed typing.
     */
    public enum Kind {
        INTEGER_AFTER_STRING,
        DECIMAL_AFTER_STRING,
        BOOLEAN_AFTER_STRING,
        /** Any other hard-typed family supplied after strings. */
        HARD_TYPED_AFTER_STRING,
        STRING_AFTER_HARD_TYPED,
        /** Two hard-typed families that share no widening group. */
        HARD_TYPED_FAMILY_CONFLICT
    }

    private final Kind kind;

    public MixedTypingException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}

package com.typeguesser.config;

/**
 * What a guesser does when two hard-typed values share no widening group,
 * for example an {@code Integer} followed by a {@code Boolean}.
 */
public enum HardTypedConflictPolicy {
    /** Raise a mixed typing error and leave the guess unchanged. */
    FAIL,
    /** Widen to string, as the string regime does for conflicting tokens. */
    FALLBACK_TO_STRING
}

package com.typeguesser.decider;

import com.typeguesser.exception.ErrorMessages;
import com.typeguesser.exception.InvalidDeciderConfigurationException;
import com.typeguesser.types.TypeTag;

import java.util.Set;

/**
 * Helpers shared by the decider implementations.
 */
final class DeciderSupport {

    private DeciderSupport() {}

    /**
     * Builds the scalar class set of a decider, refusing an empty one.
     */
    static Set<Class<?>> scalarTypes(TypeTag tag, Class<?>... types) {
        if (types == null || types.length == 0) {
            throw new InvalidDeciderConfigurationException(ErrorMessages.noScalarTypes(tag));
        }
        return Set.of(types);
    }

    /**
     * Returns the candidate without surrounding whitespace, or null if nothing remains.
     */
    static String token(String candidate) {
        if (candidate == null) {
            return null;
        }
        String token = candidate.strip();
        return token.isEmpty() ? null : token;
    }
}

package com.typeguesser.engine;

import com.typeguesser.decider.DeciderRegistry;
import com.typeguesser.decider.TypeDecider;
import com.typeguesser.exception.IncompatibleTypesException;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.DatabaseTypeRequest;
import com.typeguesser.types.TypeTag;

import java.util.Objects;

/**
 * Resolves the type two observations can share.
 *
 * <p>Rules, in order:
 * <ol>
 *   <li>nothing seen yet: the incoming type</li>
 *   <li>same type: unchanged</li>
 *   <li>either side is string: string</li>
 *   <li>same group and the group widens: the type later in preference order</li>
 *   <li>otherwise: string</li>
 * </ol>
 *
 * <p>String is absorbing, so once a column falls back it never narrows again.
 * The engine is stateless apart from its registry.
 */
public final class TypeMergeEngine {

    private final DeciderRegistry registry;

    public TypeMergeEngine(DeciderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Picks the decider able to hold values of both types.
     *
     * @param current the type so far, or null if none
     * @param incoming the type of the new value
     * @return the resolved decider
     */
    public TypeDecider resolve(TypeDecider current, TypeDecider incoming) {
        if (current == null || current == incoming) {
            return incoming;
        }
        TypeDecider string = registry.stringDecider();
        if (current == string || incoming == string) {
            return string;
        }
        if (canWiden(current, incoming)) {
            return registry.indexOf(current) >= registry.indexOf(incoming) ? current : incoming;
        }
        return string;
    }

    /**
     * Returns whether two types share a group that widens.
     *
     * @param first one type
     * @param second the other
     * @return true if values of both fit the wider of the two
     */
    public boolean canWiden(TypeDecider first, TypeDecider second) {
        return first.compatibilityGroup() == second.compatibilityGroup()
            && first.compatibilityGroup().allowsWidening();
    }

    /**
     * Returns whether combining two non-string types forces a string fallback.
     *
     * @param current the type so far, or null
     * @param incoming the type of the new value
     * @return true if the types conflict
     */
    public boolean isConflict(TypeDecider current, TypeDecider incoming) {
        return current != null
            && current != incoming
            && resolve(current, incoming) == registry.stringDecider();
    }

    /**
     * Merges two finished estimates, for example from two partitions of one column.
     *
     * <p>An {@linkplain DatabaseTypeRequest#isUnknown() unknown} side leaves the
     * other unchanged. Sizes combine component-wise; when the result is a string, its length
     * also covers both sides' renderings.
     *
     * @param first one estimate
     * @param second the other estimate
     * @param allowStringFallback whether conflicting types may become a string
     * @return the combined estimate
     * @throws IncompatibleTypesException if the types conflict and fallback is not allowed
     */
    public DatabaseTypeRequest merge(DatabaseTypeRequest first, DatabaseTypeRequest second,
                                     boolean allowStringFallback) {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (first.isUnknown()) {
            return second;
        }
        if (second.isUnknown()) {
            return first;
        }

        TypeDecider a = registry.forTag(first.typeTag());
        TypeDecider b = registry.forTag(second.typeTag());
        TypeDecider winner = resolve(a, b);
        boolean fellBack = winner.typeTag() == TypeTag.STRING
            && first.typeTag() != TypeTag.STRING
            && second.typeTag() != TypeTag.STRING;
        if (fellBack && !allowStringFallback) {
            throw new IncompatibleTypesException(first.typeTag(), second.typeTag());
        }

        DataSize size = first.size().combine(second.size());
        if (winner.typeTag() == TypeTag.STRING) {
            int length = Math.max(render(a, first.size()), render(b, second.size()));
            size = size.growLength(length);
        }
        return new DatabaseTypeRequest(winner.typeTag(), size);
    }

    private static int render(TypeDecider decider, DataSize size) {
        return decider.renderedLength(size.integerDigits(), size.fractionalDigits(), size.stringLength());
    }
}

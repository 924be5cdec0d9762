package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.util.Set;

/**
 * Sealed interface for the per-type deciders.
 *
 * <p>A decider answers whether a value can be stored as its {@link TypeTag},
 * what size that value needs, and how to parse accepted text. Deciders are
 * stateless singletons; culture rules arrive through the {@link GuessSettings}
 * argument, so one instance is safely shared by every guesser.
 *
 * <p>Acceptance and size are returned together by
 * {@link #sizeIfAcceptable(String, GuessSettings)}: a rejected candidate never
 * yields a size and an accepted one always does.
 */
public sealed interface TypeDecider
    permits BooleanTypeDecider, IntegerTypeDecider, DecimalTypeDecider,
            DateTimeTypeDecider, DurationTypeDecider, StringTypeDecider {

    TypeTag typeTag();

    CompatibilityGroup compatibilityGroup();

    /**
     * Returns the Java classes this decider accepts as hard-typed values.
     *
     * @return the supported scalar classes, never empty
     */
    Set<Class<?>> scalarTypes();

    /**
     * Tests a text candidate and measures it in one step.
     *
     * <p>The returned size covers the candidate's digits; the raw text width
     * is accreted by the caller.
     *
     * @param candidate the raw text, possibly with surrounding whitespace
     * @param settings the active settings
     * @return the size the candidate needs, or null if it is not of this type
     */
    DataSize sizeIfAcceptable(String candidate, GuessSettings settings);

    default boolean isAcceptable(String candidate, GuessSettings settings) {
        return sizeIfAcceptable(candidate, settings) != null;
    }

    /**
     * Parses text this decider has accepted.
     *
     * @param candidate previously accepted text
     * @param settings the active settings
     * @return the typed value
     * @throws com.typeguesser.exception.TypeParseException if the text is not of this type
     */
    Object parse(String candidate, GuessSettings settings);

    /**
     * Structural check for hard-typed input: no conversion, no parsing.
     *
     * @param value the value
     * @return true if the value's class is one of {@link #scalarTypes()}
     */
    default boolean acceptsScalar(Object value) {
        return value != null && scalarTypes().contains(value.getClass());
    }

    /**
     * Measures a hard-typed value, including the width of its text rendering.
     *
     * @param value a value for which {@link #acceptsScalar(Object)} is true
     * @return the size the value needs
     */
    DataSize sizeOfScalar(Object value);

    /**
     * Returns the width this type needs to render the given accreted digits
     * and text width as a string column.
     *
     * @param integerDigits accreted digits before the separator
     * @param fractionalDigits accreted digits after the separator
     * @param stringLength accreted text width
     * @return the rendered width, at least {@code stringLength}
     */
    default int renderedLength(int integerDigits, int fractionalDigits, int stringLength) {
        return stringLength;
    }
}

package com.typeguesser.engine;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.config.HardTypedConflictPolicy;
import com.typeguesser.decider.BooleanTypeDecider;
import com.typeguesser.decider.DeciderRegistry;
import com.typeguesser.decider.DecimalTypeDecider;
import com.typeguesser.decider.IntegerTypeDecider;
import com.typeguesser.decider.TypeDecider;
import com.typeguesser.exception.ErrorMessages;
import com.typeguesser.exception.MixedTypingException;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.exception.UnsupportedTypeException;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.DatabaseTypeRequest;
import com.typeguesser.types.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Incremental estimator of the narrowest column type that can hold a stream of values.
 *
 * <p>Values are absorbed one at a time with
 * {@link #adjustToCompensateForValue(Object)}. Text is classified by the
 * registry's deciders in preference order; already-typed Java values are
 * matched structurally. The estimate only ever widens: digits and widths grow,
 * integers widen to decimals within the numeric group, and types without a
 * common group fall back to string, from which there is no return.
 *
 * <p>A guesser is fed either strings or hard-typed values between resets.
 * Mixing the two raises {@link MixedTypingException}. Every update is
 * validated before any state changes, so a rejected value leaves the guess as
 * it was.
 *
 * <p>Example usage:
 * <pre>
 *   Guesser guesser = new Guesser();
 *   guesser.adjustToCompensateForValues(List.of("1", "2.50", "-300"));
 *   DatabaseTypeRequest type = guesser.guess();   // decimal(5,2)
 *   Object value = guesser.parse("2.50");          // BigDecimal 2.50
 * </pre>
 *
 * <p>Instances are not thread-safe; use one guesser per column per thread, or
 * a {@link GuesserPool}.
 */
public class Guesser {

    private static final Logger logger = LoggerFactory.getLogger(Guesser.class);

    private final GuessSettings settings;
    private final DeciderRegistry registry;
    private final TypeMergeEngine engine;
    private final TypeDecider stringDecider;
    private final TypeDecider integerDecider;
    private final TypeDecider decimalDecider;
    private final TypeDecider booleanDecider;

    private TypeDecider current;
    private int integerDigits;
    private int fractionalDigits;
    private int stringLength;
    private InputRegime regime = InputRegime.UNSET;
    private boolean fallenBack;
    private boolean requiresUnicode;
    private long valueCount;
    private long nullCount;
    // settings in force when strings were accepted, oldest first
    private final List<GuessSettings> acceptedUnder = new ArrayList<>();

    /**
     * Creates a guesser with default settings and the default registry.
     */
    public Guesser() {
        this(new GuessSettings());
    }

    public Guesser(GuessSettings settings) {
        this(settings, DeciderRegistry.defaultRegistry());
    }

    /**
     * Creates a guesser.
     *
     * @param settings the settings; owned by this guesser and read on every update
     * @param registry the deciders to consult
     */
    public Guesser(GuessSettings settings, DeciderRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.engine = new TypeMergeEngine(registry);
        this.stringDecider = registry.stringDecider();
        this.integerDecider = registry.contains(TypeTag.INTEGER) ? registry.forTag(TypeTag.INTEGER) : null;
        this.decimalDecider = registry.contains(TypeTag.DECIMAL) ? registry.forTag(TypeTag.DECIMAL) : null;
        this.booleanDecider = registry.contains(TypeTag.BOOLEAN) ? registry.forTag(TypeTag.BOOLEAN) : null;
    }

    // ==================== Updates ====================

    /**
     * Widens the estimate to cover one value.
     *
     * <p>Null, empty and whitespace-only strings change nothing but the null
     * count, which only counts actual nulls.
     *
     * @param value a string, a supported Java value, or null
     * @throws UnsupportedTypeException if no decider supports the value's class
     * @throws MixedTypingException if the value switches between strings and hard-typed values,
     *         or, under {@link HardTypedConflictPolicy#FAIL}, conflicts with earlier hard-typed values
     */
    public void adjustToCompensateForValue(Object value) {
        if (value == null) {
            nullCount++;
            return;
        }
        if (value instanceof String text) {
            absorbString(text);
        } else if (value instanceof Long || value instanceof Integer
            || value instanceof Short || value instanceof Byte) {
            absorbLong(((Number) value).longValue(), value.getClass());
        } else if (value instanceof Boolean flag) {
            adjustToCompensateForValue(flag.booleanValue());
        } else if (value instanceof BigDecimal decimal) {
            TypeDecider decider = require(decimalDecider, BigDecimal.class);
            absorbHardTyped(decider, BigDecimal.class,
                DecimalTypeDecider.integerDigits(decimal),
                DecimalTypeDecider.fractionalDigits(decimal),
                DecimalTypeDecider.renderedLength(decimal));
        } else {
            TypeDecider decider = registry.forScalar(value);
            if (decider == null) {
                throw new UnsupportedTypeException(value.getClass());
            }
            checkNotStringRegime(decider, value.getClass());
            DataSize size = decider.sizeOfScalar(value);
            absorbHardTyped(decider, value.getClass(),
                size.integerDigits(), size.fractionalDigits(), size.stringLength());
        }
    }

    /**
     * Widens the estimate to cover a primitive integer without boxing it.
     *
     * @param value the value
     */
    public void adjustToCompensateForValue(long value) {
        absorbLong(value, Long.class);
    }

    /**
     * Widens the estimate to cover a primitive boolean without boxing it.
     *
     * @param value the value
     */
    public void adjustToCompensateForValue(boolean value) {
        TypeDecider decider = require(booleanDecider, Boolean.class);
        absorbHardTyped(decider, Boolean.class, 0, 0, BooleanTypeDecider.RENDERED_LENGTH);
    }

    /**
     * Absorbs each value in turn.
     *
     * <p>Each value is applied atomically; if one is rejected, the values
     * before it remain absorbed.
     *
     * @param values the values
     */
    public void adjustToCompensateForValues(Iterable<?> values) {
        for (Object value : values) {
            adjustToCompensateForValue(value);
        }
    }

    /**
     * Forgets every value seen, returning to the freshly-constructed state.
     *
     * <p>Settings are kept.
     */
    public void reset() {
        current = null;
        integerDigits = 0;
        fractionalDigits = 0;
        stringLength = 0;
        regime = InputRegime.UNSET;
        fallenBack = false;
        requiresUnicode = false;
        valueCount = 0;
        nullCount = 0;
        acceptedUnder.clear();
    }

    // ==================== Reads ====================

    /**
     * Returns the current estimate without changing it.
     *
     * @return the estimate, or {@link DatabaseTypeRequest#unknown()} if nothing was absorbed
     */
    public DatabaseTypeRequest guess() {
        if (current == null) {
            return DatabaseTypeRequest.unknown();
        }
        int width = current.renderedLength(integerDigits, fractionalDigits, stringLength);
        return new DatabaseTypeRequest(current.typeTag(), new DataSize(integerDigits, fractionalDigits, width));
    }

    /**
     * Converts text to the guessed type.
     *
     * <p>The current settings are tried first. If they reject the text, the
     * settings in force when earlier strings were absorbed are tried, newest
     * first, so text accepted before a settings change still parses.
     *
     * @param value text of the kind this guesser absorbed
     * @return the typed value, the text itself for a string estimate, or null for null or blank text
     * @throws TypeParseException if the text is not valid for the guessed type
     */
    public Object parse(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        TypeDecider decider = current == null ? stringDecider : current;
        try {
            return decider.parse(value, settings);
        } catch (TypeParseException e) {
            for (int i = acceptedUnder.size() - 1; i >= 0; i--) {
                GuessSettings earlier = acceptedUnder.get(i);
                if (earlier.equals(settings)) {
                    continue;
                }
                if (decider.isAcceptable(value, earlier)) {
                    return decider.parse(value, earlier);
                }
            }
            throw e;
        }
    }

    public GuessResult result() {
        return new GuessResult(guess(), requiresUnicode, valueCount, nullCount);
    }

    public boolean isPrimedWithHardType() {
        return regime == InputRegime.HARD_TYPED;
    }

    public InputRegime inputRegime() {
        return regime;
    }

    /**
     * Returns whether any absorbed value held a non-ASCII character.
     *
     * @return true if a unicode-capable column is needed
     */
    public boolean requiresUnicode() {
        return requiresUnicode;
    }

    public long getValueCount() {
        return valueCount;
    }

    public long getNullCount() {
        return nullCount;
    }

    /**
     * Returns the live settings of this guesser.
     *
     * <p>Changing them between updates changes how later values are read;
     * the estimate so far is not revisited.
     *
     * @return the settings
     */
    public GuessSettings getSettings() {
        return settings;
    }

    public DeciderRegistry getRegistry() {
        return registry;
    }

    // ==================== Internals ====================

    private void absorbString(String value) {
        if (value.isBlank()) {
            return;
        }
        if (regime == InputRegime.HARD_TYPED) {
            throw new MixedTypingException(MixedTypingException.Kind.STRING_AFTER_HARD_TYPED,
                ErrorMessages.stringAfterHardTyped(current.typeTag()));
        }

        // classify from scratch every time so that the result does not depend on arrival order
        TypeDecider chosen = stringDecider;
        DataSize size = DataSize.EMPTY;
        for (int i = 0; i < registry.size(); i++) {
            TypeDecider decider = registry.get(i);
            DataSize accepted = decider.sizeIfAcceptable(value, settings);
            if (accepted != null) {
                chosen = decider;
                size = accepted;
                break;
            }
        }

        rememberSettings();
        int nonAscii = countNonAscii(value);
        int length = value.length() + nonAscii * settings.getExtraLengthPerNonAsciiCharacter();
        commit(engine.resolve(current, chosen), engine.isConflict(current, chosen),
            size.integerDigits(), size.fractionalDigits(), Math.max(length, size.stringLength()),
            nonAscii > 0, InputRegime.STRING);
    }

    private void rememberSettings() {
        int last = acceptedUnder.size() - 1;
        if (last < 0 || !acceptedUnder.get(last).equals(settings)) {
            acceptedUnder.add(settings.copy());
        }
    }

    private void absorbLong(long value, Class<?> type) {
        TypeDecider decider = require(integerDecider, type);
        absorbHardTyped(decider, type,
            IntegerTypeDecider.digitCount(value), 0, IntegerTypeDecider.renderedLength(value));
    }

    private void absorbHardTyped(TypeDecider incoming, Class<?> type,
                                 int intDigits, int fracDigits, int length) {
        checkNotStringRegime(incoming, type);
        boolean conflict = engine.isConflict(current, incoming);
        if (conflict && !fallenBack
            && settings.getHardTypedConflictPolicy() == HardTypedConflictPolicy.FAIL) {
            throw new MixedTypingException(MixedTypingException.Kind.HARD_TYPED_FAMILY_CONFLICT,
                ErrorMessages.hardTypedFamilyConflict(type, incoming.typeTag(), current.typeTag()));
        }
        commit(engine.resolve(current, incoming), conflict, intDigits, fracDigits, length,
            false, InputRegime.HARD_TYPED);
    }

    private void checkNotStringRegime(TypeDecider incoming, Class<?> type) {
        if (regime != InputRegime.STRING) {
            return;
        }
        switch (incoming.typeTag()) {
            case INTEGER -> throw new MixedTypingException(
                MixedTypingException.Kind.INTEGER_AFTER_STRING, ErrorMessages.integerAfterString());
            case DECIMAL -> throw new MixedTypingException(
                MixedTypingException.Kind.DECIMAL_AFTER_STRING, ErrorMessages.decimalAfterString());
            case BOOLEAN -> throw new MixedTypingException(
                MixedTypingException.Kind.BOOLEAN_AFTER_STRING, ErrorMessages.booleanAfterString());
            default -> throw new MixedTypingException(
                MixedTypingException.Kind.HARD_TYPED_AFTER_STRING, ErrorMessages.hardTypedAfterString(type));
        }
    }

    private void commit(TypeDecider winner, boolean conflict, int intDigits, int fracDigits, int length,
                        boolean unicode, InputRegime newRegime) {
        if (conflict) {
            if (!fallenBack && current != stringDecider) {
                logger.debug("Column estimate fell back from {} to {}",
                    current.typeTag().typeName(), winner.typeTag().typeName());
            }
            fallenBack = true;
        }
        current = winner;
        integerDigits = Math.max(integerDigits, intDigits);
        fractionalDigits = Math.max(fractionalDigits, fracDigits);
        stringLength = Math.max(stringLength, length);
        requiresUnicode |= unicode;
        regime = newRegime;
        valueCount++;
    }

    private static TypeDecider require(TypeDecider decider, Class<?> type) {
        if (decider == null) {
            throw new UnsupportedTypeException(type);
        }
        return decider;
    }

    private static int countNonAscii(String value) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) > 0x7F) {
                count++;
            }
        }
        return count;
    }
}

package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.ErrorMessages;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.exception.UnsupportedTypeException;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Recognizes decimal numbers, including exponent notation.
 *
 * <p>Sizes count digits before and after the separator exactly as written:
 * {@code 1.50} needs one integer digit and two fractional digits. Exponents
 * are expanded, so {@code 1E3} needs four integer digits.
 */
public final class DecimalTypeDecider implements TypeDecider {

    private static final DecimalTypeDecider INSTANCE = new DecimalTypeDecider();

    private final Set<Class<?>> scalarTypes = DeciderSupport.scalarTypes(
        TypeTag.DECIMAL, BigDecimal.class, Float.class, Double.class);

    private DecimalTypeDecider() {}

    public static DecimalTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.DECIMAL;
    }

    @Override
    public CompatibilityGroup compatibilityGroup() {
        return CompatibilityGroup.NUMERICAL;
    }

    @Override
    public Set<Class<?>> scalarTypes() {
        return scalarTypes;
    }

    @Override
    public DataSize sizeIfAcceptable(String candidate, GuessSettings settings) {
        BigDecimal value = valueOf(candidate, settings);
        return value == null ? null : DataSize.ofNumeric(integerDigits(value), fractionalDigits(value));
    }

    @Override
    public Object parse(String candidate, GuessSettings settings) {
        BigDecimal value = valueOf(candidate, settings);
        if (value == null) {
            throw new TypeParseException(candidate, TypeTag.DECIMAL);
        }
        return value;
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        BigDecimal decimal;
        if (value instanceof BigDecimal d) {
            decimal = d;
        } else if (value instanceof Double d) {
            requireFinite(d.isNaN() || d.isInfinite(), value);
            decimal = BigDecimal.valueOf(d);
        } else if (value instanceof Float f) {
            requireFinite(f.isNaN() || f.isInfinite(), value);
            decimal = new BigDecimal(Float.toString(f));
        } else {
            throw new UnsupportedTypeException(value.getClass());
        }
        if (decimal.scale() < 0) {
            decimal = decimal.setScale(0);
        }
        return sizeOf(decimal);
    }

    @Override
    public int renderedLength(int integerDigits, int fractionalDigits, int stringLength) {
        int numeric = Math.max(integerDigits, 1) + (fractionalDigits > 0 ? fractionalDigits + 1 : 0);
        return Math.max(stringLength, numeric);
    }

    /**
     * Measures a decimal value, including its plain text width.
     *
     * @param value the value
     * @return the size the value needs
     */
    public static DataSize sizeOf(BigDecimal value) {
        return new DataSize(integerDigits(value), fractionalDigits(value), renderedLength(value));
    }

    /**
     * Digits before the decimal separator, 0 for values such as {@code 0.5}.
     *
     * @param value the value
     * @return the integer digit count
     */
    public static int integerDigits(BigDecimal value) {
        int scale = value.scale();
        if (scale < 0) {
            return value.precision() - scale;
        }
        return Math.max(value.precision() - scale, 0);
    }

    public static int fractionalDigits(BigDecimal value) {
        return Math.max(value.scale(), 0);
    }

    /**
     * Width of the value's plain rendering, sign and separator included.
     *
     * @param value the value
     * @return the rendered width
     */
    public static int renderedLength(BigDecimal value) {
        int fraction = fractionalDigits(value);
        return (value.signum() < 0 ? 1 : 0)
            + Math.max(integerDigits(value), 1)
            + (fraction > 0 ? fraction + 1 : 0);
    }

    private static void requireFinite(boolean nonFinite, Object value) {
        if (nonFinite) {
            throw new UnsupportedTypeException(ErrorMessages.nonFiniteNumber(value), value.getClass());
        }
    }

    private static BigDecimal valueOf(String candidate, GuessSettings settings) {
        String token = DeciderSupport.token(candidate);
        if (token == null || settings.getExplicitDatePolicy().isExplicitDate(token, settings)) {
            return null;
        }
        NumberText.ParsedNumber number = NumberText.parse(token, settings.getCultureConfig(), true);
        if (number == null) {
            return null;
        }
        BigDecimal value = number.value();
        return value.scale() < 0 ? value.setScale(0) : value;
    }
}

package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Set;

/**
 * Recognizes whole numbers that fit a signed 64-bit integer.
 *
 * <p>Text may carry a sign and culture grouping separators. A decimal
 * separator, an exponent or a value outside the {@code long} range leaves the
 * candidate to {@link DecimalTypeDecider}. Tokens the settings' explicit date
 * policy flags as dates are rejected.
 */
public final class IntegerTypeDecider implements TypeDecider {

    private static final IntegerTypeDecider INSTANCE = new IntegerTypeDecider();

    private final Set<Class<?>> scalarTypes = DeciderSupport.scalarTypes(
        TypeTag.INTEGER, Byte.class, Short.class, Integer.class, Long.class, BigInteger.class);

    private IntegerTypeDecider() {}

    public static IntegerTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.INTEGER;
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
        return value == null ? null : DataSize.ofNumeric(value.precision(), 0);
    }

    @Override
    public Object parse(String candidate, GuessSettings settings) {
        BigDecimal value = valueOf(candidate, settings);
        if (value == null) {
            throw new TypeParseException(candidate, TypeTag.INTEGER);
        }
        return value.longValueExact();
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        if (value instanceof BigInteger big) {
            int digits = big.signum() == 0 ? 1 : big.abs().toString().length();
            return new DataSize(digits, 0, digits + (big.signum() < 0 ? 1 : 0));
        }
        long v = ((Number) value).longValue();
        return new DataSize(digitCount(v), 0, renderedLength(v));
    }

    @Override
    public int renderedLength(int integerDigits, int fractionalDigits, int stringLength) {
        return Math.max(stringLength, integerDigits);
    }

    /**
     * Counts the decimal digits of a value, ignoring its sign.
     *
     * @param value the value
     * @return the digit count, 1 for zero
     */
    public static int digitCount(long value) {
        if (value == 0) {
            return 1;
        }
        int digits = 0;
        for (long v = value; v != 0; v /= 10) {
            digits++;
        }
        return digits;
    }

    /**
     * Returns the width of the value's decimal rendering, sign included.
     *
     * @param value the value
     * @return the rendered width
     */
    public static int renderedLength(long value) {
        return digitCount(value) + (value < 0 ? 1 : 0);
    }

    private static BigDecimal valueOf(String candidate, GuessSettings settings) {
        String token = DeciderSupport.token(candidate);
        if (token == null || settings.getExplicitDatePolicy().isExplicitDate(token, settings)) {
            return null;
        }
        NumberText.ParsedNumber number = NumberText.parse(token, settings.getCultureConfig(), false);
        if (number == null || !number.integral() || number.value().unscaledValue().bitLength() > 63) {
            return null;
        }
        return number.value();
    }
}

package com.typeguesser.types;

/**
 * Width metadata accreted while guessing a column type.
 *
 * <p>Holds the number of digits before and after the decimal separator and the
 * longest text rendering seen. Values are immutable; every growth operation
 * returns a size whose fields are never smaller than the inputs', so
 * {@link #combine(DataSize)} is commutative, associative and idempotent.
 *
 * <p>Negative arguments are clamped to zero.
 *
 * @param integerDigits digits before the decimal separator
 * @param fractionalDigits digits after the decimal separator (the scale)
 * @param stringLength the width in characters needed to render every value
 */
public record DataSize(int integerDigits, int fractionalDigits, int stringLength) {

    public static final DataSize EMPTY = new DataSize(0, 0, 0);

    public DataSize {
        integerDigits = Math.max(0, integerDigits);
        fractionalDigits = Math.max(0, fractionalDigits);
        stringLength = Math.max(0, stringLength);
    }

    public static DataSize ofNumeric(int integerDigits, int fractionalDigits) {
        return new DataSize(integerDigits, fractionalDigits, 0);
    }

    public static DataSize ofLength(int stringLength) {
        return new DataSize(0, 0, stringLength);
    }

    /**
     * Grows the digit counts to cover the given ones.
     *
     * @param integerDigits digits before the separator to cover
     * @param fractionalDigits digits after the separator to cover
     * @return this size if already large enough, otherwise a grown copy
     */
    public DataSize growNumeric(int integerDigits, int fractionalDigits) {
        if (integerDigits <= this.integerDigits && fractionalDigits <= this.fractionalDigits) {
            return this;
        }
        return new DataSize(
            Math.max(this.integerDigits, integerDigits),
            Math.max(this.fractionalDigits, fractionalDigits),
            stringLength);
    }

    /**
     * Grows the string length to cover {@code length} characters.
     *
     * @param length the width to cover
     * @return this size if already large enough, otherwise a grown copy
     */
    public DataSize growLength(int length) {
        if (length <= stringLength) {
            return this;
        }
        return new DataSize(integerDigits, fractionalDigits, length);
    }

    /**
     * Component-wise maximum of two sizes.
     *
     * @param other the size to merge with
     * @return a size covering both
     */
    public DataSize combine(DataSize other) {
        if (other == null || other == this) {
            return this;
        }
        return growNumeric(other.integerDigits, other.fractionalDigits).growLength(other.stringLength);
    }

    /**
     * Returns the total number of significant digits (decimal precision).
     *
     * @return integer plus fractional digits
     */
    public int precision() {
        return integerDigits + fractionalDigits;
    }

    public int scale() {
        return fractionalDigits;
    }

    /**
     * Returns the width of the widest number these digit counts describe,
     * including the decimal separator but not a sign.
     *
     * @return the rendered numeric width, or 0 if no digits were recorded
     */
    public int numericRenderedLength() {
        if (integerDigits == 0 && fractionalDigits == 0) {
            return 0;
        }
        return integerDigits + fractionalDigits + (fractionalDigits > 0 ? 1 : 0);
    }

    public boolean isEmpty() {
        return integerDigits == 0 && fractionalDigits == 0 && stringLength == 0;
    }

    /**
     * Returns whether every field of this size is at least the other's.
     *
     * @param other the size to compare against
     * @return true if this size already covers {@code other}
     */
    public boolean covers(DataSize other) {
        return integerDigits >= other.integerDigits
            && fractionalDigits >= other.fractionalDigits
            && stringLength >= other.stringLength;
    }
}

package com.typeguesser.types;

import java.util.Objects;

/**
 * The storage type and size a consumer should create a column with.
 *
 * <p>Produced by reading a guess; callers never build one to mutate state.
 *
 * @param typeTag the inferred type
 * @param size the accreted width metadata
 */
public record DatabaseTypeRequest(TypeTag typeTag, DataSize size) {

    public DatabaseTypeRequest {
        Objects.requireNonNull(typeTag, "typeTag must not be null");
        size = size != null ? size : DataSize.EMPTY;
    }

    /**
     * The widest safe default: a zero-width string.
     *
     * @return a string request with an empty size
     */
    public static DatabaseTypeRequest unknown() {
        return new DatabaseTypeRequest(TypeTag.STRING, DataSize.EMPTY);
    }

    /**
     * Returns whether this is the estimate of a column that held no values.
     *
     * @return true for a string request with an empty size
     */
    public boolean isUnknown() {
        return typeTag == TypeTag.STRING && size.isEmpty();
    }

    /**
     * Returns the decimal precision, meaningful for numeric types.
     *
     * @return integer plus fractional digits
     */
    public int precision() {
        return size.precision();
    }

    public int scale() {
        return size.scale();
    }

    /**
     * Returns the width in characters needed to render every observed value.
     *
     * @return the string length, never smaller than the numeric rendering
     */
    public int width() {
        return Math.max(size.stringLength(), size.numericRenderedLength());
    }

    /**
     * Returns a compact description such as {@code decimal(5,2)} or {@code string(10)}.
     *
     * @return the type name with its size parameters
     */
    public String typeName() {
        return switch (typeTag) {
            case DECIMAL -> String.format("%s(%d,%d)", typeTag.typeName(), precision(), scale());
            case INTEGER -> String.format("%s(%d)", typeTag.typeName(), size.integerDigits());
            case STRING -> String.format("%s(%d)", typeTag.typeName(), width());
            default -> typeTag.typeName();
        };
    }

    @Override
    public String toString() {
        return typeName();
    }
}

package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.util.Set;
import java.util.UUID;

/**
 * The universal fallback: accepts any text.
 *
 * <p>A string column must be wide enough for every value it may hold, so its
 * rendered width also covers the digits accreted by numeric values.
 */
public final class StringTypeDecider implements TypeDecider {

    private static final StringTypeDecider INSTANCE = new StringTypeDecider();

    private static final int UUID_LENGTH = 36;

    private final Set<Class<?>> scalarTypes =
        DeciderSupport.scalarTypes(TypeTag.STRING, Character.class, UUID.class);

    private StringTypeDecider() {}

    public static StringTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.STRING;
    }

    @Override
    public CompatibilityGroup compatibilityGroup() {
        return CompatibilityGroup.TEXTUAL;
    }

    @Override
    public Set<Class<?>> scalarTypes() {
        return scalarTypes;
    }

    @Override
    public DataSize sizeIfAcceptable(String candidate, GuessSettings settings) {
        return DataSize.EMPTY;
    }

    @Override
    public Object parse(String candidate, GuessSettings settings) {
        return candidate;
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        return DataSize.ofLength(value instanceof UUID ? UUID_LENGTH : 1);
    }

    @Override
    public int renderedLength(int integerDigits, int fractionalDigits, int stringLength) {
        if (integerDigits == 0 && fractionalDigits == 0) {
            return stringLength;
        }
        // numbers such as .5 render with a leading zero
        int numeric = Math.max(integerDigits, 1) + (fractionalDigits > 0 ? fractionalDigits + 1 : 0);
        return Math.max(stringLength, numeric);
    }
}

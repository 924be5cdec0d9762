package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.TypeParseException;
import com.typeguesser.types.CompatibilityGroup;
import com.typeguesser.types.DataSize;
import com.typeguesser.types.TypeTag;

import java.util.Set;

/**
 * Recognizes boolean words such as {@code true}, {@code no} or {@code .T.}.
 *
 * <p>Digits are never booleans, so {@code 1} and {@code 0} stay integers.
 * Single letters ({@code Y}, {@code N}, ...) count only when
 * {@link GuessSettings#isCharCanBeBoolean()} is set.
 */
public final class BooleanTypeDecider implements TypeDecider {

    private static final BooleanTypeDecider INSTANCE = new BooleanTypeDecider();

    /** Width of {@code false}, the longest rendering. */
    public static final int RENDERED_LENGTH = 5;

    private static final DataSize SCALAR_SIZE = DataSize.ofLength(RENDERED_LENGTH);

    private final Set<Class<?>> scalarTypes = DeciderSupport.scalarTypes(TypeTag.BOOLEAN, Boolean.class);

    private BooleanTypeDecider() {}

    public static BooleanTypeDecider get() {
        return INSTANCE;
    }

    @Override
    public TypeTag typeTag() {
        return TypeTag.BOOLEAN;
    }

    @Override
    public CompatibilityGroup compatibilityGroup() {
        return CompatibilityGroup.BOOLEAN;
    }

    @Override
    public Set<Class<?>> scalarTypes() {
        return scalarTypes;
    }

    @Override
    public DataSize sizeIfAcceptable(String candidate, GuessSettings settings) {
        return valueOf(candidate, settings) != null ? DataSize.EMPTY : null;
    }

    @Override
    public Object parse(String candidate, GuessSettings settings) {
        Boolean value = valueOf(candidate, settings);
        if (value == null) {
            throw new TypeParseException(candidate, TypeTag.BOOLEAN);
        }
        return value;
    }

    @Override
    public DataSize sizeOfScalar(Object value) {
        return SCALAR_SIZE;
    }

    private static Boolean valueOf(String candidate, GuessSettings settings) {
        String token = DeciderSupport.token(candidate);
        if (token == null) {
            return null;
        }
        return settings.getCultureConfig().booleanValue(token, settings.isCharCanBeBoolean());
    }
}

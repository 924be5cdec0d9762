package com.typeguesser.decider;

import com.typeguesser.config.GuessSettings;
import com.typeguesser.exception.ErrorMessages;
import com.typeguesser.exception.InvalidDeciderConfigurationException;
import com.typeguesser.types.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The ordered set of deciders a guesser consults.
 *
 * <p>Order is preference: a text candidate belongs to the first decider that
 * accepts it, and within a widening group the later decider is the wider
 * type. The string decider must come last so that every candidate is
 * accepted by someone.
 *
 * <p>Registries are immutable and shared. The default registry orders
 * boolean, integer, decimal, date-time, duration, string.
 */
public final class DeciderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(DeciderRegistry.class);

    private static final DeciderRegistry DEFAULT = new DeciderRegistry(List.of(
        BooleanTypeDecider.get(),
        IntegerTypeDecider.get(),
        DecimalTypeDecider.get(),
        DateTimeTypeDecider.get(),
        DurationTypeDecider.get(),
        StringTypeDecider.get()));

    private final TypeDecider[] order;
    private final Map<TypeTag, Integer> positions = new EnumMap<>(TypeTag.class);

    /**
     * Creates a registry from deciders in preference order.
     *
     * @param deciders the deciders, ending with {@link StringTypeDecider}
     * @throws InvalidDeciderConfigurationException if the list is empty, repeats
     *         a type, does not end with the string decider, or holds a decider
     *         without scalar types
     */
    public DeciderRegistry(List<? extends TypeDecider> deciders) {
        Objects.requireNonNull(deciders, "deciders must not be null");
        if (deciders.isEmpty() || !(deciders.get(deciders.size() - 1) instanceof StringTypeDecider)) {
            throw new InvalidDeciderConfigurationException(
                "The string decider must be registered last, got " + deciders);
        }
        this.order = deciders.toArray(new TypeDecider[0]);
        for (int i = 0; i < order.length; i++) {
            TypeDecider decider = Objects.requireNonNull(order[i], "decider must not be null");
            if (decider.scalarTypes() == null || decider.scalarTypes().isEmpty()) {
                throw new InvalidDeciderConfigurationException(ErrorMessages.noScalarTypes(decider.typeTag()));
            }
            if (positions.put(decider.typeTag(), i) != null) {
                throw new InvalidDeciderConfigurationException(
                    "Type " + decider.typeTag().typeName() + " is registered more than once");
            }
        }
        logger.debug("Decider preference order: {}", Arrays.stream(order).map(TypeDecider::typeTag).toList());
    }

    public static DeciderRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Returns the deciders in preference order.
     *
     * @return an immutable list
     */
    public List<TypeDecider> preferenceOrder() {
        return List.of(order);
    }

    public int size() {
        return order.length;
    }

    /**
     * Returns the decider at a preference position, without allocating.
     *
     * @param index position in preference order
     * @return the decider
     */
    public TypeDecider get(int index) {
        return order[index];
    }

    /**
     * Returns the preference position of a decider.
     *
     * @param decider the decider
     * @return its index, or -1 if it is not registered
     */
    public int indexOf(TypeDecider decider) {
        Integer position = positions.get(decider.typeTag());
        return position == null ? -1 : position;
    }

    public boolean contains(TypeTag tag) {
        return positions.containsKey(tag);
    }

    /**
     * Looks up the decider for a type tag.
     *
     * @param tag the type
     * @return the decider
     * @throws IllegalArgumentException if no decider is registered for the tag
     */
    public TypeDecider forTag(TypeTag tag) {
        Integer position = positions.get(tag);
        if (position == null) {
            throw new IllegalArgumentException("No decider registered for type " + tag.typeName());
        }
        return order[position];
    }

    /**
     * Finds the decider whose scalar types include the value's class.
     *
     * @param value a hard-typed value
     * @return the decider, or null if none supports the value
     */
    public TypeDecider forScalar(Object value) {
        for (TypeDecider decider : order) {
            if (decider.acceptsScalar(value)) {
                return decider;
            }
        }
        return null;
    }

    /**
     * Returns the first decider, in preference order, that accepts the text.
     *
     * @param candidate the text
     * @param settings the active settings
     * @return the accepting decider, never null
     */
    public TypeDecider classify(String candidate, GuessSettings settings) {
        for (TypeDecider decider : order) {
            if (decider.isAcceptable(candidate, settings)) {
                return decider;
            }
        }
        return stringDecider();
    }

    public TypeDecider stringDecider() {
        return order[order.length - 1];
    }
}

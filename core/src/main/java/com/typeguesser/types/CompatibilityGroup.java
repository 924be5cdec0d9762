package com.typeguesser.types;

/**
 * Groups of types that are related to one another.
 *
 * <p>Two estimates from the same group may be merged without falling back to
 * text only when the group {@linkplain #allowsWidening() allows widening};
 * the wider member (the one later in preference order) then wins.
 * Estimates from different groups always fall back to {@link TypeTag#STRING}.
 */
public enum CompatibilityGroup {

    /** Integer widens into decimal. */
    NUMERICAL(true),

    /**
     * Date/time and duration. A timestamp cannot hold a duration and vice
     * versa, so members never widen into each other.
     */
    TEMPORAL(false),

    BOOLEAN(false),

    /** The universal string type; accepts everything. */
    TEXTUAL(false);

    private final boolean allowsWidening;

    CompatibilityGroup(boolean allowsWidening) {
        this.allowsWidening = allowsWidening;
    }

    /**
     * Returns whether distinct members of this group may widen into one another.
     *
     * @return true if the later member in preference order can hold every
     *         value of the earlier ones
     */
    public boolean allowsWidening() {
        return allowsWidening;
    }
}

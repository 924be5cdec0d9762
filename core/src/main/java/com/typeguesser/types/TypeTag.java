package com.typeguesser.types;

/**
 * Storage primitive a column can be created as.
 *
 * <p>Every observed value is mapped to one of these tags, with
 * {@link #STRING} as the universal fallback.
 */
public enum TypeTag {
    BOOLEAN("boolean"),
    INTEGER("integer"),
    DECIMAL("decimal"),
    DATE_TIME("datetime"),
    DURATION("duration"),
    STRING("string");

    private final String typeName;

    TypeTag(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns a human-readable name for this type.
     *
     * @return the type name
     */
    public String typeName() {
        return typeName;
    }
}

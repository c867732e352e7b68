package io.github.reugn.stringly4j;

/**
 * Type tag of a {@link Value}.
 * <p>
 * Every variant of {@link Value} maps to exactly one constant. The {@link #typeName()} of a tag
 * is the identifier reported in {@link TypeMismatchException} and returned by
 * {@link Leaf#typeName()}.
 */
public enum ValueType {

    INTEGER("integer"),
    DOUBLE("double"),
    STRING("string");

    private final String typeName;

    ValueType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Returns the human-readable name of this tag.
     *
     * @return {@code "integer"}, {@code "double"} or {@code "string"}
     */
    public String typeName() {
        return typeName;
    }

    @Override
    public String toString() {
        return typeName;
    }
}

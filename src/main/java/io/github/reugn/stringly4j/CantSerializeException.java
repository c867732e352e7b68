package io.github.reugn.stringly4j;

/**
 * Thrown when an aggregate is read as a whole.
 *
 * <p>{@link Value} has no structured variant, so an empty path is only meaningful on a leaf.
 */
public class CantSerializeException extends AccessException {

    private static final long serialVersionUID = 1L;

    private final String typeName;

    /**
     * Creates a new exception.
     *
     * @param typeName the name of the aggregate that was read
     */
    public CantSerializeException(String typeName) {
        super("Cannot represent " + typeName + " as a value; append a field name to the path");
        this.typeName = typeName;
    }

    /**
     * @return the name of the aggregate that was read
     */
    public String typeName() {
        return typeName;
    }
}

package io.github.reugn.stringly4j;

/**
 * Thrown when a value cannot be stored because its type differs from the target's type.
 *
 * <p>Raised by a {@link Leaf} whose tag differs from the incoming value's tag, and by an
 * {@link AggregateAccessor} asked to overwrite the whole aggregate with a scalar.
 *
 * <pre>
 * Type mismatch: expected integer but found double
 * </pre>
 */
public class TypeMismatchException extends AccessException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    /**
     * Creates a new exception.
     *
     * @param expected the type name of the target
     * @param found    the type name of the rejected value
     */
    public TypeMismatchException(String expected, String found) {
        super("Type mismatch: expected " + expected + " but found " + found);
        this.expected = expected;
        this.found = found;
    }

    /**
     * @return the type name of the target
     */
    public String expected() {
        return expected;
    }

    /**
     * @return the type name of the rejected value
     */
    public String found() {
        return found;
    }
}

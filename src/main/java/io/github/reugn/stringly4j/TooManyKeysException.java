package io.github.reugn.stringly4j;

/**
 * Thrown when a path still has segments left on reaching a leaf.
 *
 * <p>The count includes the segment that hit the leaf, so {@code "y.z"} applied to a
 * {@code long} reports two.
 */
public class TooManyKeysException extends AccessException {

    private static final long serialVersionUID = 1L;

    private final int elementsRemaining;

    /**
     * Creates a new exception.
     *
     * @param elementsRemaining the number of unconsumed path segments
     */
    public TooManyKeysException(int elementsRemaining) {
        super("Too many keys: " + elementsRemaining + " path segment"
                + (elementsRemaining == 1 ? "" : "s") + " left after reaching a leaf");
        this.elementsRemaining = elementsRemaining;
    }

    /**
     * @return the number of unconsumed path segments
     */
    public int elementsRemaining() {
        return elementsRemaining;
    }
}

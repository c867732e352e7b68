package io.github.reugn.stringly4j;

/**
 * Base class of every failure reported by an {@link Accessor}.
 *
 * <p>Each subclass carries the data needed to explain the failure to a user without
 * re-deriving it:
 * <ul>
 *   <li>{@link TypeMismatchException} - the value's tag does not match the target</li>
 *   <li>{@link TooManyKeysException} - the path continues past a leaf</li>
 *   <li>{@link UnknownFieldException} - a path segment names no field of an aggregate</li>
 *   <li>{@link CantSerializeException} - an aggregate was read as a whole</li>
 * </ul>
 *
 * <p>Accessors never wrap, retry or log these exceptions. They reach the caller exactly as
 * raised by the level that detected them.
 */
public abstract class AccessException extends Exception {

    private static final long serialVersionUID = 1L;

    protected AccessException(String message) {
        super(message);
    }
}

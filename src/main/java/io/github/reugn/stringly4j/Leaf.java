package io.github.reugn.stringly4j;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Terminal case of path resolution: a field holding a single {@link Value}.
 *
 * <p>A leaf accepts only the empty path. Java primitives cannot be updated through a reference,
 * so {@link #set} returns the replacement and the owning aggregate assigns it:
 * <pre>{@code
 * target.y = Leaf.INTEGER.set(rest, value);
 * }</pre>
 * The assignment happens only after every check has passed.
 *
 * @param <T> the Java type stored in the field
 */
public final class Leaf<T> {

    /**
     * Leaf for {@code long} fields.
     */
    public static final Leaf<Long> INTEGER = new Leaf<>(ValueType.INTEGER,
            Value.IntegerValue::new, value -> ((Value.IntegerValue) value).value());

    /**
     * Leaf for {@code double} fields.
     */
    public static final Leaf<Double> DOUBLE = new Leaf<>(ValueType.DOUBLE,
            Value.DoubleValue::new, value -> ((Value.DoubleValue) value).value());

    /**
     * Leaf for {@code String} fields.
     */
    public static final Leaf<String> STRING = new Leaf<>(ValueType.STRING,
            Value.StringValue::new, value -> ((Value.StringValue) value).value());

    private final ValueType type;
    private final Function<T, Value> wrap;
    private final Function<Value, T> unwrap;

    private Leaf(ValueType type, Function<T, Value> wrap, Function<Value, T> unwrap) {
        this.type = type;
        this.wrap = wrap;
        this.unwrap = unwrap;
    }

    /**
     * Wraps the current content of the field.
     *
     * @param current the field content
     * @param path    must be empty
     * @return {@code current} as a {@link Value}
     * @throws TooManyKeysException if {@code path} is not empty
     */
    public Value get(T current, List<String> path) throws TooManyKeysException {
        requireEnd(path);
        return wrap.apply(current);
    }

    /**
     * Wraps the current content of a field that may be unset.
     *
     * <p>The path is checked before the content, so an over-long path on an unset field still
     * reports {@link TooManyKeysException}.
     *
     * @param current the field content
     * @param field   the field name, for the error message
     * @param path    must be empty
     * @return {@code current} as a {@link Value}
     * @throws TooManyKeysException if {@code path} is not empty
     * @throws NullPointerException if {@code current} is {@code null}
     */
    public Value get(T current, String field, List<String> path) throws TooManyKeysException {
        requireEnd(path);
        return wrap.apply(Objects.requireNonNull(current, () -> "Field '" + field + "' is null"));
    }

    /**
     * Checks and unwraps a replacement for the field.
     *
     * @param path  must be empty
     * @param value the replacement
     * @return the unwrapped replacement
     * @throws TooManyKeysException  if {@code path} is not empty
     * @throws TypeMismatchException if {@code value} is not of this leaf's type
     */
    public T set(List<String> path, Value value) throws TooManyKeysException, TypeMismatchException {
        requireEnd(path);
        if (value.type() != type) {
            throw new TypeMismatchException(type.typeName(), value.type().typeName());
        }
        return unwrap.apply(value);
    }

    /**
     * @return the tag of values stored in this leaf
     */
    public ValueType type() {
        return type;
    }

    /**
     * @return the tag name, e.g. {@code "integer"}
     */
    public String typeName() {
        return type.typeName();
    }

    private static void requireEnd(List<String> path) throws TooManyKeysException {
        if (!path.isEmpty()) {
            throw new TooManyKeysException(path.size());
        }
    }

    @Override
    public String toString() {
        return "Leaf[" + type.typeName() + "]";
    }
}

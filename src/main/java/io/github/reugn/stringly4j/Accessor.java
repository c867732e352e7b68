package io.github.reugn.stringly4j;

import java.util.List;

/**
 * Reads and writes the fields of a {@code T} addressed by a run-time path.
 *
 * <p>A path is consumed one segment per aggregate level. {@link AggregateAccessor} implements
 * the aggregate level and delegates to {@link Leaf} for {@code long}, {@code double} and
 * {@code String} fields. Implementations are normally generated for classes annotated with
 * {@link io.github.reugn.stringly4j.annotation.StringlyTyped}:
 * <pre>{@code
 * Outer thing = new Outer();
 * OuterAccessor.INSTANCE.set(thing, "inner.y", Value.of(-7L));
 * Value y = OuterAccessor.INSTANCE.get(thing, "inner.y");   // IntegerValue[value=-7]
 * }</pre>
 *
 * <p>Accessors are stateless. Callers that share a target between threads must provide their
 * own mutual exclusion.
 *
 * @param <T> the accessed type
 */
public interface Accessor<T> {

    /**
     * Returns the value reached by consuming the whole path.
     *
     * @param target the object to read; not modified
     * @param path   the path segments
     * @return the value of the addressed leaf
     * @throws AccessException if the path does not address a leaf of {@code target}
     */
    Value getValue(T target, List<String> path) throws AccessException;

    /**
     * Replaces the value reached by consuming the whole path.
     *
     * <p>{@code target} is modified only if the call succeeds.
     *
     * @param target the object to modify
     * @param path   the path segments
     * @param value  the replacement; its tag must match the addressed leaf
     * @throws AccessException if the path does not address a leaf of {@code target}
     *                         or the value has the wrong type
     */
    void setValue(T target, List<String> path, Value value) throws AccessException;

    /**
     * Returns the declared name of the accessed type.
     *
     * @return the type name used in error reports
     */
    String typeName();

    /**
     * Same as {@link #getValue(Object, List)} with {@code key} split by {@link Keys#split}.
     */
    default Value get(T target, String key) throws AccessException {
        return getValue(target, Keys.split(key));
    }

    /**
     * Same as {@link #setValue(Object, List, Value)} with {@code key} split by {@link Keys#split}.
     */
    default void set(T target, String key, Value value) throws AccessException {
        setValue(target, Keys.split(key), value);
    }
}

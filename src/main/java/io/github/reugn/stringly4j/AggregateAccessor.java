package io.github.reugn.stringly4j;

import java.util.List;
import java.util.Objects;

/**
 * Recursive case of path resolution: an aggregate that consumes one path segment and delegates
 * the rest to the field it names.
 *
 * <p>Subclasses supply the per-field dispatch in {@link #getField} and {@link #setField}: compare
 * the segment against each declared field in order, delegate on a match, and end with
 * {@code throw unknownField(field)}. The annotation processor generates exactly that:
 * <pre>{@code
 * protected Value getField(Inner target, String field, List<String> rest) throws AccessException {
 *     if (field.equals("x")) {
 *         return Leaf.DOUBLE.get(target.x, rest);
 *     }
 *     if (field.equals("y")) {
 *         return Leaf.INTEGER.get(target.y, rest);
 *     }
 *     if (field.equals("keyValuePair")) {
 *         return getNested(KeyValueAccessor.INSTANCE, target.keyValuePair, "keyValuePair", rest);
 *     }
 *     throw unknownField(field);
 * }
 * }</pre>
 *
 * <p><b>Empty paths:</b>
 * <ul>
 *   <li>{@code getValue} fails with {@link CantSerializeException}: {@link Value} has no
 *       structured variant</li>
 *   <li>{@code setValue} fails with {@link TypeMismatchException} expecting the aggregate's
 *       type name: a scalar cannot replace a whole aggregate</li>
 * </ul>
 *
 * <p>Errors raised below this level pass through unchanged.
 *
 * @param <T> the aggregate type
 */
public abstract class AggregateAccessor<T> implements Accessor<T> {

    private final String typeName;
    private final List<String> fieldNames;

    /**
     * @param typeName   the declared name of the aggregate
     * @param fieldNames the declared field names, in declaration order
     */
    protected AggregateAccessor(String typeName, List<String> fieldNames) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.fieldNames = List.copyOf(fieldNames);
    }

    @Override
    public final Value getValue(T target, List<String> path) throws AccessException {
        if (path.isEmpty()) {
            throw new CantSerializeException(typeName);
        }
        return getField(target, path.get(0), path.subList(1, path.size()));
    }

    @Override
    public final void setValue(T target, List<String> path, Value value) throws AccessException {
        if (path.isEmpty()) {
            throw new TypeMismatchException(typeName, value.type().typeName());
        }
        setField(target, path.get(0), path.subList(1, path.size()), value);
    }

    @Override
    public final String typeName() {
        return typeName;
    }

    /**
     * Returns the declared field names.
     *
     * @return the names, in declaration order; immutable
     */
    public final List<String> fieldNames() {
        return fieldNames;
    }

    /**
     * Reads the field named {@code field}.
     *
     * @param target the aggregate
     * @param field  the first path segment
     * @param rest   the remaining segments, to be passed to the field's accessor
     * @return the field accessor's result
     * @throws AccessException from the field accessor, or {@link #unknownField} if no field matches
     */
    protected abstract Value getField(T target, String field, List<String> rest) throws AccessException;

    /**
     * Writes the field named {@code field}.
     *
     * @param target the aggregate
     * @param field  the first path segment
     * @param rest   the remaining segments, to be passed to the field's accessor
     * @param value  the replacement, passed on unchanged
     * @throws AccessException from the field accessor, or {@link #unknownField} if no field matches
     */
    protected abstract void setField(T target, String field, List<String> rest, Value value)
            throws AccessException;

    /**
     * Builds the error for a segment that matched no field.
     *
     * @param field the unmatched segment
     * @return the exception to throw
     */
    protected final UnknownFieldException unknownField(String field) {
        return new UnknownFieldException(typeName, field, fieldNames);
    }

    /**
     * Reads through a nested aggregate field.
     *
     * <p>An empty {@code rest} fails with {@link CantSerializeException} before the field content
     * is inspected, so the outcome does not depend on whether the field is set.
     *
     * @param accessor the accessor of the field type
     * @param value    the field content
     * @param field    the field name
     * @param rest     the remaining segments
     * @param <F>      the field type
     * @return the nested accessor's result
     * @throws AccessException      from the nested accessor
     * @throws NullPointerException if {@code rest} is not empty and {@code value} is {@code null}
     */
    protected static <F> Value getNested(AggregateAccessor<F> accessor, F value, String field, List<String> rest)
            throws AccessException {
        if (rest.isEmpty()) {
            throw new CantSerializeException(accessor.typeName());
        }
        return accessor.getValue(requireField(value, field), rest);
    }

    /**
     * Writes through a nested aggregate field.
     *
     * <p>An empty {@code rest} fails with {@link TypeMismatchException} before the field content
     * is inspected.
     *
     * @param accessor    the accessor of the field type
     * @param value       the field content
     * @param field       the field name
     * @param rest        the remaining segments
     * @param replacement the value to write, passed on unchanged
     * @param <F>         the field type
     * @throws AccessException      from the nested accessor
     * @throws NullPointerException if {@code rest} is not empty and {@code value} is {@code null}
     */
    protected static <F> void setNested(AggregateAccessor<F> accessor, F value, String field, List<String> rest,
                                        Value replacement) throws AccessException {
        if (rest.isEmpty()) {
            throw new TypeMismatchException(accessor.typeName(), replacement.type().typeName());
        }
        accessor.setValue(requireField(value, field), rest, replacement);
    }

    private static <F> F requireField(F value, String field) {
        return Objects.requireNonNull(value, () -> "Field '" + field + "' is null");
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + typeName + "]";
    }
}

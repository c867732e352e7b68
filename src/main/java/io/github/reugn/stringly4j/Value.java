package io.github.reugn.stringly4j;

import java.util.Objects;

/**
 * A dynamically typed value moved across the boundary between a statically typed aggregate
 * and a string path.
 *
 * <p>The set of variants is closed:
 * <table border="1">
 *   <caption>Value variants</caption>
 *   <tr><th>Variant</th><th>Payload</th><th>Tag</th></tr>
 *   <tr><td>{@link IntegerValue}</td><td>{@code long}</td><td>{@link ValueType#INTEGER}</td></tr>
 *   <tr><td>{@link DoubleValue}</td><td>{@code double}</td><td>{@link ValueType#DOUBLE}</td></tr>
 *   <tr><td>{@link StringValue}</td><td>{@code String}</td><td>{@link ValueType#STRING}</td></tr>
 * </table>
 *
 * <p>Variants are records, so two values are equal when they have the same tag and payload.
 * Doubles compare with {@link Double#compare} semantics, which makes {@code NaN} equal to itself.
 *
 * <pre>{@code
 * Value v = Value.of(42L);
 * v.type();                          // ValueType.INTEGER
 * v.equals(new Value.IntegerValue(42)) // true
 * }</pre>
 */
public sealed interface Value permits Value.IntegerValue, Value.DoubleValue, Value.StringValue {

    /**
     * Returns the type tag of this value.
     *
     * @return the tag of the active variant
     */
    ValueType type();

    /**
     * Wraps a signed 64-bit integer.
     *
     * @param value the integer
     * @return an {@link IntegerValue}
     */
    static Value of(long value) {
        return new IntegerValue(value);
    }

    /**
     * Wraps a 64-bit floating point number.
     *
     * @param value the number
     * @return a {@link DoubleValue}
     */
    static Value of(double value) {
        return new DoubleValue(value);
    }

    /**
     * Wraps a string.
     *
     * @param value the string, never {@code null}
     * @return a {@link StringValue}
     * @throws NullPointerException if {@code value} is {@code null}
     */
    static Value of(String value) {
        return new StringValue(value);
    }

    /**
     * Integer variant.
     *
     * @param value the payload
     */
    record IntegerValue(long value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.INTEGER;
        }
    }

    /**
     * Floating point variant.
     *
     * @param value the payload
     */
    record DoubleValue(double value) implements Value {
        @Override
        public ValueType type() {
            return ValueType.DOUBLE;
        }
    }

    /**
     * Text variant.
     *
     * @param value the payload, never {@code null}
     */
    record StringValue(String value) implements Value {
        public StringValue {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueType type() {
            return ValueType.STRING;
        }
    }
}

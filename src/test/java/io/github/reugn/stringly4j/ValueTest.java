package io.github.reugn.stringly4j;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;

@DisplayName("Value")
class ValueTest {

    @Test
    @DisplayName("Factories pick the variant matching the Java type")
    void factories() {
        assertThat(Value.of(42L)).isEqualTo(new Value.IntegerValue(42));
        assertThat(Value.of(3.14)).isEqualTo(new Value.DoubleValue(3.14));
        assertThat(Value.of("text")).isEqualTo(new Value.StringValue("text"));
    }

    @Test
    @DisplayName("Each variant reports its own tag")
    void tags() {
        assertThat(Value.of(1L).type()).isEqualTo(ValueType.INTEGER);
        assertThat(Value.of(1.0).type()).isEqualTo(ValueType.DOUBLE);
        assertThat(Value.of("1").type()).isEqualTo(ValueType.STRING);
    }

    @Test
    @DisplayName("Tag names match the names used in type errors")
    void tagNames() {
        assertThat(ValueType.INTEGER.typeName()).isEqualTo("integer");
        assertThat(ValueType.DOUBLE.typeName()).isEqualTo("double");
        assertThat(ValueType.STRING.typeName()).isEqualTo("string");
        assertThat(ValueType.DOUBLE).hasToString("double");
    }

    @Test
    @DisplayName("Values of different variants are never equal")
    void variantsDiffer() {
        assertThat(Value.of(1L)).isNotEqualTo(Value.of(1.0));
        assertThat(Value.of("1")).isNotEqualTo(Value.of(1L));
    }

    @Test
    @DisplayName("NaN equals NaN and -0.0 differs from 0.0")
    void doubleEquality() {
        assertThat(Value.of(Double.NaN)).isEqualTo(Value.of(Double.NaN));
        assertThat(Value.of(-0.0)).isNotEqualTo(Value.of(0.0));
    }

    @Test
    @DisplayName("Extreme integers survive wrapping")
    void extremeIntegers() {
        assertThat(((Value.IntegerValue) Value.of(Long.MIN_VALUE)).value()).isEqualTo(Long.MIN_VALUE);
        assertThat(((Value.IntegerValue) Value.of(Long.MAX_VALUE)).value()).isEqualTo(Long.MAX_VALUE);
    }

    @Test
    @DisplayName("Null strings are rejected")
    void nullString() {
        assertThatNullPointerException().isThrownBy(() -> Value.of((String) null));
    }
}

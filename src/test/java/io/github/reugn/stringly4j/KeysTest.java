package io.github.reugn.stringly4j;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Keys")
class KeysTest {

    @Test
    @DisplayName("Splits on every dot, in order")
    void split() {
        assertThat(Keys.split("inner.keyValuePair.key")).containsExactly("inner", "keyValuePair", "key");
        assertThat(Keys.split("inner")).containsExactly("inner");
    }

    @Test
    @DisplayName("Keeps empty segments")
    void emptySegments() {
        assertThat(Keys.split("")).containsExactly("");
        assertThat(Keys.split("inner.")).containsExactly("inner", "");
        assertThat(Keys.split(".y")).containsExactly("", "y");
        assertThat(Keys.split("a..b")).containsExactly("a", "", "b");
    }

    @Test
    @DisplayName("Dot is literal, not a regular expression")
    void literalDot() {
        assertThat(Keys.split("a*b.c")).containsExactly("a*b", "c");
    }
}

package io.github.reugn.stringly4j;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits dotted keys into path segments.
 */
public final class Keys {

    private static final Pattern DOT = Pattern.compile(".", Pattern.LITERAL);

    private Keys() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Splits {@code key} on every {@code '.'}.
     *
     * <p>Empty segments are kept, so a malformed key fails on access instead of silently
     * addressing another field:
     * <ul>
     *   <li>{@code "inner.y"} → {@code [inner, y]}</li>
     *   <li>{@code "inner."} → {@code [inner, ""]}</li>
     *   <li>{@code ""} → {@code [""]}</li>
     * </ul>
     *
     * @param key the dotted key
     * @return the segments, in order; immutable
     */
    public static List<String> split(String key) {
        return List.of(DOT.split(key, -1));
    }
}

package io.github.reugn.stringly4j;

import java.util.List;
import java.util.Optional;

/**
 * Thrown when a path segment names no field of an aggregate.
 *
 * <p>Carries the complete list of the aggregate's fields so the caller can offer alternatives,
 * plus the closest match when the segment looks like a typo:
 * <pre>
 * Field 'yy' not found in Inner. Did you mean 'y'? Available fields: x, y, keyValuePair.
 * Field 'bogus' not found in Outer. Available fields: inner.
 * </pre>
 */
public class UnknownFieldException extends AccessException {

    private static final long serialVersionUID = 1L;

    private final String typeName;
    private final String field;
    private final List<String> validFields;
    private final String suggestion;

    /**
     * Creates a new exception.
     *
     * @param typeName    the name of the aggregate that was searched
     * @param field       the segment that matched no field
     * @param validFields every field of the aggregate, in declaration order
     */
    public UnknownFieldException(String typeName, String field, List<String> validFields) {
        this(typeName, field, List.copyOf(validFields), Similarity.findSimilar(field, validFields));
    }

    private UnknownFieldException(String typeName, String field, List<String> validFields, String suggestion) {
        super(message(typeName, field, validFields, suggestion));
        this.typeName = typeName;
        this.field = field;
        this.validFields = validFields;
        this.suggestion = suggestion;
    }

    private static String message(String typeName, String field, List<String> validFields, String suggestion) {
        StringBuilder message = new StringBuilder();
        message.append("Field '").append(field).append("' not found in ").append(typeName).append('.');
        if (suggestion != null) {
            message.append(" Did you mean '").append(suggestion).append("'?");
        }
        message.append(" Available fields: ").append(String.join(", ", validFields)).append('.');
        return message.toString();
    }

    /**
     * @return the name of the aggregate that was searched
     */
    public String typeName() {
        return typeName;
    }

    /**
     * @return the segment that matched no field
     */
    public String field() {
        return field;
    }

    /**
     * @return every field of the aggregate, in declaration order; immutable
     */
    public List<String> validFields() {
        return validFields;
    }

    /**
     * @return the field closest to {@link #field()} by edit distance, if any is close enough
     */
    public Optional<String> suggestion() {
        return Optional.ofNullable(suggestion);
    }
}

package io.github.reugn.stringly4j.fixture;

import io.github.reugn.stringly4j.AccessException;
import io.github.reugn.stringly4j.AggregateAccessor;
import io.github.reugn.stringly4j.Value;

import java.util.List;

/**
 * Hand-written in the shape the processor generates.
 */
public final class OuterAccessor extends AggregateAccessor<Outer> {
    public static final OuterAccessor INSTANCE = new OuterAccessor();

    private OuterAccessor() {
        super("Outer", List.of("inner"));
    }

    @Override
    protected Value getField(Outer target, String field, List<String> rest) throws AccessException {
        if (field.equals("inner")) {
            return getNested(InnerAccessor.INSTANCE, target.inner, "inner", rest);
        }
        throw unknownField(field);
    }

    @Override
    protected void setField(Outer target, String field, List<String> rest, Value value) throws AccessException {
        if (field.equals("inner")) {
            setNested(InnerAccessor.INSTANCE, target.inner, "inner", rest, value);
            return;
        }
        throw unknownField(field);
    }
}

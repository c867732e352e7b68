package io.github.reugn.stringly4j.fixture;

import io.github.reugn.stringly4j.AccessException;
import io.github.reugn.stringly4j.AggregateAccessor;
import io.github.reugn.stringly4j.Leaf;
import io.github.reugn.stringly4j.Value;

import java.util.List;

public final class InnerAccessor extends AggregateAccessor<Inner> {
    public static final InnerAccessor INSTANCE = new InnerAccessor();

    private InnerAccessor() {
        super("Inner", List.of("x", "y", "keyValuePair"));
    }

    @Override
    protected Value getField(Inner target, String field, List<String> rest) throws AccessException {
        if (field.equals("x")) {
            return Leaf.DOUBLE.get(target.x, rest);
        }
        if (field.equals("y")) {
            return Leaf.INTEGER.get(target.y, rest);
        }
        if (field.equals("keyValuePair")) {
            return getNested(KeyValueAccessor.INSTANCE, target.keyValuePair, "keyValuePair", rest);
        }
        throw unknownField(field);
    }

    @Override
    protected void setField(Inner target, String field, List<String> rest, Value value) throws AccessException {
        if (field.equals("x")) {
            target.x = Leaf.DOUBLE.set(rest, value);
            return;
        }
        if (field.equals("y")) {
            target.y = Leaf.INTEGER.set(rest, value);
            return;
        }
        if (field.equals("keyValuePair")) {
            setNested(KeyValueAccessor.INSTANCE, target.keyValuePair, "keyValuePair", rest, value);
            return;
        }
        throw unknownField(field);
    }
}

package io.github.reugn.stringly4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates an {@link io.github.reugn.stringly4j.Accessor} for a class, giving run-time
 * access to its fields by dotted path.
 * <p>
 * Every non-static, non-transient field takes part, in declaration order. Supported field types:
 * <ul>
 *   <li>{@code long}, {@code double}, {@code String}</li>
 *   <li>classes annotated with {@code @StringlyTyped}, or included with {@link IncludeStringly}</li>
 * </ul>
 * Fields must not be {@code private} or {@code final}. A class with no eligible field is
 * rejected at compile time.
 *
 * <p><b>Example:</b>
 * <pre>
 * {@code
 * @StringlyTyped
 * public class Outer {
 *     Inner inner = new Inner();
 * }
 *
 * @StringlyTyped
 * public class Inner {
 *     double x = 3.14;
 *     long y = 42;
 * }
 *
 * // Usage - OuterAccessor is generated next to Outer:
 * Outer thing = new Outer();
 * OuterAccessor.INSTANCE.set(thing, "inner.y", Value.of(-7L));  // thing.inner.y == -7
 * OuterAccessor.INSTANCE.get(thing, "inner.x");                 // Value.of(3.14)
 * OuterAccessor.INSTANCE.get(thing, "inner");                   // CantSerializeException
 * }
 * </pre>
 *
 * <p>The generated class is named {@code {ClassName}Accessor}; for a nested class the enclosing
 * names are joined with {@code _}, e.g. {@code Config_NetworkAccessor}. The suffix can be changed
 * with the {@code -Astringly4j.suffix=...} compiler option.
 *
 * <p>Retained in class files so that annotated types compiled earlier can still be nested.
 *
 * @see IncludeStringly
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.CLASS)
public @interface StringlyTyped {
}

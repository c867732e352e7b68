package io.github.reugn.stringly4j.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Generates accessors for classes you cannot annotate, such as types from another library.
 * <p>
 * Place it on any class of your own; the accessors are generated in that class's package.
 * Because they live outside the included type's package, every eligible field of an included
 * type must be {@code public}.
 *
 * <p><b>Example:</b>
 * <pre>
 * {@code
 * // From a library you cannot modify
 * package com.vendor.geo;
 * public class Point {
 *     public double lat;
 *     public double lon;
 * }
 *
 * // Your code
 * package com.example;
 *
 * @IncludeStringly(Point.class)
 * public class GeoAccessors {
 * }
 *
 * // Usage - com.example.PointAccessor is generated:
 * PointAccessor.INSTANCE.set(point, "lat", Value.of(52.52));
 * }
 * </pre>
 *
 * <p>Included types may nest each other and {@link StringlyTyped} types. A type may be included
 * only once, and never when it is itself annotated with {@link StringlyTyped}.
 *
 * @see StringlyTyped
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.SOURCE)
public @interface IncludeStringly {

    /**
     * The classes to generate accessors for.
     *
     * @return the included classes
     */
    Class<?>[] value();
}

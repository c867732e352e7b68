/**
 * Run-time access to the fields of nested classes by string path.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.stringly4j.Value} - the dynamic value union and its
 *       {@link io.github.reugn.stringly4j.ValueType} tags</li>
 *   <li>{@link io.github.reugn.stringly4j.Accessor} - the get/set-by-path contract</li>
 *   <li>{@link io.github.reugn.stringly4j.Leaf} - the terminal case for {@code long}, {@code double}
 *       and {@code String} fields</li>
 *   <li>{@link io.github.reugn.stringly4j.AggregateAccessor} - the recursive case, extended by
 *       generated accessors</li>
 *   <li>{@link io.github.reugn.stringly4j.AccessException} and its subclasses - what went wrong</li>
 * </ul>
 *
 * @see io.github.reugn.stringly4j.annotation.StringlyTyped
 */
package io.github.reugn.stringly4j;

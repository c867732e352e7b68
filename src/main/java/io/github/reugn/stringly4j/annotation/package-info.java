/**
 * Annotations that generate path accessors at compile time.
 * <p>
 * This package provides:
 * <ul>
 *   <li>{@link io.github.reugn.stringly4j.annotation.StringlyTyped} - Generate an accessor for your own class</li>
 *   <li>{@link io.github.reugn.stringly4j.annotation.IncludeStringly} - Generate accessors for external classes</li>
 * </ul>
 * <p>
 * Both are processed by {@link io.github.reugn.stringly4j.processor.StringlyProcessor},
 * generating one {@code {ClassName}Accessor} class per accessed type.
 *
 * @see io.github.reugn.stringly4j.processor.StringlyProcessor
 */
package io.github.reugn.stringly4j.annotation;

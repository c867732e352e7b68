/**
 * Annotation processor implementation for stringly4j.
 * <p>
 * Generates one {@link io.github.reugn.stringly4j.AggregateAccessor} subclass per type annotated
 * with {@link io.github.reugn.stringly4j.annotation.StringlyTyped} or included with
 * {@link io.github.reugn.stringly4j.annotation.IncludeStringly}.
 * <p>
 * <b>Internal implementation</b> - not part of the public API.
 *
 * <p><b>Architecture:</b>
 * <pre>
 * StringlyProcessor (entry point)
 *     ├── IncludeCollector   - reads @IncludeStringly
 *     ├── AccessorRegistry   - type → accessor class
 *     ├── ValidationUtils    - type and field checks
 *     └── AccessorGenerator  - JavaPoet output
 *
 * Support utilities:
 *     ├── CodeGenUtils     - naming, field model
 *     ├── ProcessorOptions - -A compiler options
 *     └── ErrorReporter    - error reporting interface
 * </pre>
 *
 * @see io.github.reugn.stringly4j.annotation
 */
package io.github.reugn.stringly4j.processor;

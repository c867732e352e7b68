package io.github.reugn.stringly4j.processor;

import javax.lang.model.element.Element;

import static io.github.reugn.stringly4j.processor.AccessorRegistry.AccessTarget;

/**
 * Reports compilation errors against source elements.
 */
@FunctionalInterface
interface ErrorReporter {
    /**
     * Reports an error on the given element.
     *
     * @param element the element where the error occurred
     * @param message the error message
     */
    void error(Element element, String message);

    /**
     * Reports a problem of an accessed type.
     *
     * <p>Problems of included types go to the {@code @IncludeStringly} placeholder, prefixed with
     * the included class, since the included type is usually not part of the compilation.
     *
     * @param target  the accessed type
     * @param element the offending element within the type
     * @param message the error message
     */
    default void error(AccessTarget target, Element element, String message) {
        if (target.included()) {
            error(target.origin(), "@IncludeStringly(" + target.type().getSimpleName() + ".class): " + message);
        } else {
            error(element, message);
        }
    }
}

package io.github.reugn.stringly4j.processor;

import com.squareup.javapoet.ClassName;
import io.github.reugn.stringly4j.annotation.StringlyTyped;

import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Knows which accessor class serves each accessed type.
 *
 * <p>Types collected in the current round map to the accessor about to be generated. A type
 * annotated with {@link StringlyTyped} but compiled earlier (found on the class path) maps to
 * the accessor generated next to it back then.
 */
final class AccessorRegistry {

    private final String suffix;
    private final Map<TypeElement, AccessTarget> targets = new LinkedHashMap<>();

    AccessorRegistry(String suffix) {
        this.suffix = suffix;
    }

    /**
     * Registers a type annotated with {@link StringlyTyped}; its accessor goes in its own package.
     *
     * @param type the annotated type
     * @return {@code false} if the type was already registered
     */
    boolean addAnnotated(TypeElement type) {
        ClassName accessor = CodeGenUtils.accessorName(type, CodeGenUtils.packageOf(type), suffix);
        return targets.putIfAbsent(type, new AccessTarget(type, accessor, type, false)) == null;
    }

    /**
     * Registers a type named by an {@code @IncludeStringly}; its accessor goes in the package of
     * the annotated placeholder.
     *
     * @param type        the included type
     * @param placeholder the class bearing {@code @IncludeStringly}
     * @return {@code false} if the type was already registered
     */
    boolean addIncluded(TypeElement type, TypeElement placeholder) {
        ClassName accessor = CodeGenUtils.accessorName(type, CodeGenUtils.packageOf(placeholder), suffix);
        return targets.putIfAbsent(type, new AccessTarget(type, accessor, placeholder, true)) == null;
    }

    /**
     * Returns the registered target for a type, if any.
     */
    AccessTarget get(TypeElement type) {
        return targets.get(type);
    }

    /**
     * Resolves the accessor of a field's type.
     *
     * @param type the field type
     * @return the accessor class, or {@code null} if the type cannot be accessed by path
     */
    ClassName resolve(TypeElement type) {
        AccessTarget target = targets.get(type);
        if (target != null) {
            return target.accessor();
        }
        if (type.getAnnotation(StringlyTyped.class) != null) {
            return CodeGenUtils.accessorName(type, CodeGenUtils.packageOf(type), suffix);
        }
        return null;
    }

    Collection<AccessTarget> targets() {
        return targets.values();
    }

    /**
     * A type to generate an accessor for.
     *
     * @param type     the accessed type
     * @param accessor the accessor class to generate
     * @param origin   where to report problems: the type itself, or the {@code @IncludeStringly} placeholder
     * @param included {@code true} if registered through {@code @IncludeStringly}
     */
    record AccessTarget(TypeElement type, ClassName accessor, Element origin, boolean included) {

        /**
         * Whether the generated accessor lives in another package than the accessed type.
         */
        boolean crossesPackage() {
            return !accessor.packageName().equals(CodeGenUtils.packageOf(type));
        }
    }
}

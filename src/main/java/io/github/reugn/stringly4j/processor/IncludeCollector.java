package io.github.reugn.stringly4j.processor;

import io.github.reugn.stringly4j.annotation.IncludeStringly;
import io.github.reugn.stringly4j.annotation.StringlyTyped;

import javax.lang.model.element.TypeElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.MirroredTypesException;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;

/**
 * Registers the external types named by {@code @IncludeStringly}.
 *
 * <p><b>Use Case:</b>
 * <pre>{@code
 * // External class you cannot modify
 * public class Point { public double lat; public double lon; }
 *
 * // Your placeholder class
 * @IncludeStringly(Point.class)
 * public class GeoAccessors {}
 *
 * // Generated in the placeholder's package
 * PointAccessor.INSTANCE.get(point, "lat");
 * }</pre>
 *
 * <p><b>Validation:</b>
 * <ul>
 *   <li>Included types must be classes</li>
 *   <li>A type annotated with {@code @StringlyTyped} cannot also be included</li>
 *   <li>A type can be included only once per compilation</li>
 * </ul>
 * Field-level checks happen later, in {@link ValidationUtils#collectFields}.
 *
 * @see io.github.reugn.stringly4j.annotation.IncludeStringly
 */
final class IncludeCollector {

    private final AccessorRegistry registry;
    private final ErrorReporter errorReporter;

    IncludeCollector(AccessorRegistry registry, ErrorReporter errorReporter) {
        this.registry = registry;
        this.errorReporter = errorReporter;
    }

    /**
     * Registers every type included by a placeholder class.
     *
     * @param placeholder the class bearing {@code @IncludeStringly}
     */
    void collect(TypeElement placeholder) {
        List<TypeMirror> includedTypes = getIncludedTypes(placeholder);
        if (includedTypes.isEmpty()) {
            errorReporter.error(placeholder, "@IncludeStringly requires at least one class.");
            return;
        }

        for (TypeMirror mirror : includedTypes) {
            if (mirror.getKind() != TypeKind.DECLARED) {
                errorReporter.error(placeholder, "@IncludeStringly cannot include " + mirror + "; it is not a class.");
                continue;
            }
            TypeElement type = (TypeElement) ((DeclaredType) mirror).asElement();

            if (!ValidationUtils.validateIncludedKind(type, placeholder, errorReporter)) {
                continue;
            }
            if (type.getAnnotation(StringlyTyped.class) != null) {
                errorReporter.error(placeholder, "@IncludeStringly cannot include " + type.getQualifiedName()
                        + "; it is annotated with @StringlyTyped and has its own accessor.");
                continue;
            }
            if (!registry.addIncluded(type, placeholder)) {
                errorReporter.error(placeholder, type.getQualifiedName() + " is included more than once. "
                        + "Each type can have only one accessor.");
            }
        }
    }

    /**
     * Extracts the included types from {@code @IncludeStringly.value()}.
     *
     * <p>Reading a {@code Class} member during annotation processing throws
     * {@link MirroredTypesException}, which carries the type mirrors instead.
     *
     * @param placeholder the element bearing {@code @IncludeStringly}
     * @return the included type mirrors, in declaration order
     */
    private static List<TypeMirror> getIncludedTypes(TypeElement placeholder) {
        List<TypeMirror> types = new ArrayList<>();
        try {
            IncludeStringly annotation = placeholder.getAnnotation(IncludeStringly.class);
            @SuppressWarnings("unused")
            Class<?>[] ignored = annotation.value();
        } catch (MirroredTypesException e) {
            types.addAll(e.getTypeMirrors());
        }
        return types;
    }
}

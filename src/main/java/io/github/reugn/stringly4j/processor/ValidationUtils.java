package io.github.reugn.stringly4j.processor;

import com.squareup.javapoet.ClassName;
import io.github.reugn.stringly4j.ValueType;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static io.github.reugn.stringly4j.processor.AccessorRegistry.AccessTarget;
import static io.github.reugn.stringly4j.processor.CodeGenUtils.FieldInfo;

/**
 * Compile-time validation of accessed types and their fields.
 *
 * <p>Problems are reported as compiler errors with an actionable message instead of producing
 * an accessor that fails to compile or misbehaves at run time.
 *
 * <p><b>Type checks:</b>
 * <ul>
 *   <li>Must be a class: records, enums, interfaces and annotations are rejected</li>
 *   <li>Must not be generic</li>
 *   <li>Must not be private; must be public when the accessor is generated in another package</li>
 *   <li>Must declare at least one eligible field</li>
 * </ul>
 *
 * <p><b>Field checks</b> (static and transient fields are skipped):
 * <ul>
 *   <li>Must not be private; must be public when the accessor is generated in another package</li>
 *   <li>Must not be final</li>
 *   <li>Type must be {@code long}, {@code double}, {@code String}, or an accessed class</li>
 * </ul>
 *
 * <p><b>Example error messages:</b>
 * <pre>
 * error: Field 'count' has unsupported type int. Use long instead.
 * error: Field 'inner' is private. Generated accessors cannot access private fields. Use package-private, protected, or public visibility.
 * error: Empty declares no accessible fields. A class without fields cannot be accessed by path.
 * </pre>
 */
final class ValidationUtils {

    private static final String STRING_TYPE = "java.lang.String";
    private static final Set<Modifier> SKIPPED = Set.of(Modifier.STATIC, Modifier.TRANSIENT);

    private ValidationUtils() {
    }

    // ==================== TYPE VALIDATION ====================

    /**
     * Checks that an element annotated with {@code @StringlyTyped} is a class.
     *
     * @param element       the annotated element
     * @param errorReporter callback for reporting errors
     * @return {@code true} if the element is a class
     */
    static boolean validateAnnotatedKind(Element element, ErrorReporter errorReporter) {
        String problem = kindProblem(element.getKind());
        if (problem != null) {
            errorReporter.error(element, "@StringlyTyped can only be applied to classes; " + problem);
            return false;
        }
        return true;
    }

    /**
     * Checks that a type named by {@code @IncludeStringly} is a class.
     *
     * @param type          the included type
     * @param placeholder   the class bearing {@code @IncludeStringly}
     * @param errorReporter callback for reporting errors
     * @return {@code true} if the type is a class
     */
    static boolean validateIncludedKind(TypeElement type, TypeElement placeholder, ErrorReporter errorReporter) {
        String problem = kindProblem(type.getKind());
        if (problem != null) {
            errorReporter.error(placeholder, "@IncludeStringly cannot include "
                    + type.getQualifiedName() + "; " + problem);
            return false;
        }
        return true;
    }

    private static String kindProblem(ElementKind kind) {
        return switch (kind) {
            case CLASS -> null;
            case RECORD -> "records are immutable and their components cannot be set";
            case ENUM -> "enums have no settable state";
            case INTERFACE, ANNOTATION_TYPE -> "interfaces have no fields";
            default -> kind.name().toLowerCase(Locale.ROOT) + " is not a class";
        };
    }

    // ==================== FIELD COLLECTION ====================

    /**
     * Collects and validates the fields of a target in declaration order.
     *
     * <p>Continues past the first problem so that all of them are reported in one compilation.
     *
     * @param target        the type to generate an accessor for
     * @param registry      resolves accessors of nested field types
     * @param errorReporter callback for reporting errors
     * @return the fields, or {@code null} if any error was reported
     */
    static List<FieldInfo> collectFields(AccessTarget target, AccessorRegistry registry,
                                         ErrorReporter errorReporter) {
        TypeElement type = target.type();
        boolean valid = validateType(target, errorReporter);

        List<FieldInfo> fields = new ArrayList<>();
        for (Element enclosed : type.getEnclosedElements()) {
            if (enclosed.getKind() != ElementKind.FIELD) {
                continue;
            }
            VariableElement field = (VariableElement) enclosed;
            if (field.getModifiers().stream().anyMatch(SKIPPED::contains)) {
                continue;
            }

            FieldInfo info = validateField(target, field, registry, errorReporter);
            if (info == null) {
                valid = false;
            } else {
                fields.add(info);
            }
        }

        if (valid && fields.isEmpty()) {
            errorReporter.error(target, type, type.getSimpleName()
                    + " declares no accessible fields. A class without fields cannot be accessed by path.");
            valid = false;
        }

        return valid ? fields : null;
    }

    private static boolean validateType(AccessTarget target, ErrorReporter errorReporter) {
        TypeElement type = target.type();
        boolean valid = true;

        if (!type.getTypeParameters().isEmpty()) {
            errorReporter.error(target, type, type.getSimpleName()
                    + " is generic. Path accessors need concrete field types.");
            valid = false;
        }

        Element current = type;
        while (current instanceof TypeElement) {
            Set<Modifier> modifiers = current.getModifiers();
            if (modifiers.contains(Modifier.PRIVATE)) {
                errorReporter.error(target, type, "Class '" + current.getSimpleName()
                        + "' is private. Generated accessors cannot access private classes.");
                valid = false;
                break;
            }
            if (target.crossesPackage() && !modifiers.contains(Modifier.PUBLIC)) {
                errorReporter.error(target, type, "Class '" + current.getSimpleName()
                        + "' must be public to be accessed from package " + target.accessor().packageName() + ".");
                valid = false;
                break;
            }
            current = current.getEnclosingElement();
        }
        return valid;
    }

    private static FieldInfo validateField(AccessTarget target, VariableElement field,
                                           AccessorRegistry registry, ErrorReporter errorReporter) {
        String name = field.getSimpleName().toString();
        Set<Modifier> modifiers = field.getModifiers();
        boolean valid = true;

        if (modifiers.contains(Modifier.PRIVATE)) {
            errorReporter.error(target, field, "Field '" + name + "' is private. "
                    + "Generated accessors cannot access private fields. "
                    + "Use package-private, protected, or public visibility.");
            valid = false;
        } else if (target.crossesPackage() && !modifiers.contains(Modifier.PUBLIC)) {
            errorReporter.error(target, field, "Field '" + name + "' must be public to be accessed from package "
                    + target.accessor().packageName() + ".");
            valid = false;
        }

        if (modifiers.contains(Modifier.FINAL)) {
            errorReporter.error(target, field, "Field '" + name + "' is final and cannot be set by path. "
                    + "Remove the final modifier or mark the field transient to exclude it.");
            valid = false;
        }

        FieldInfo info = classify(field, registry);
        if (info == null) {
            errorReporter.error(target, field, "Field '" + name + "' has unsupported type "
                    + field.asType() + ". " + unsupportedTypeHint(field.asType()));
            valid = false;
        }

        return valid ? info : null;
    }

    // ==================== TYPE CLASSIFICATION ====================

    /**
     * Maps a field to its leaf type or nested accessor.
     *
     * @param field    the field
     * @param registry resolves accessors of nested types
     * @return the resolved field, or {@code null} if its type is unsupported
     */
    static FieldInfo classify(VariableElement field, AccessorRegistry registry) {
        TypeMirror type = field.asType();
        switch (type.getKind()) {
            case LONG:
                return FieldInfo.leaf(field, ValueType.INTEGER);
            case DOUBLE:
                return FieldInfo.leaf(field, ValueType.DOUBLE);
            case DECLARED:
                TypeElement element = (TypeElement) ((DeclaredType) type).asElement();
                if (element.getQualifiedName().contentEquals(STRING_TYPE)) {
                    return FieldInfo.leaf(field, ValueType.STRING);
                }
                if (!((DeclaredType) type).getTypeArguments().isEmpty()) {
                    return null;
                }
                ClassName accessor = registry.resolve(element);
                return accessor == null ? null : FieldInfo.nested(field, accessor);
            default:
                return null;
        }
    }

    private static String unsupportedTypeHint(TypeMirror type) {
        String supported = "Supported types: long, double, String, "
                + "or a class annotated with @StringlyTyped or included with @IncludeStringly.";
        TypeKind kind = type.getKind();
        if (kind == TypeKind.INT || kind == TypeKind.SHORT || kind == TypeKind.BYTE) {
            return "Use long instead.";
        }
        if (kind == TypeKind.FLOAT) {
            return "Use double instead.";
        }
        if (kind == TypeKind.DECLARED) {
            DeclaredType declared = (DeclaredType) type;
            TypeElement element = (TypeElement) declared.asElement();
            String qualifiedName = element.getQualifiedName().toString();
            if (qualifiedName.equals("java.lang.Long")) {
                return "Use the primitive long instead.";
            }
            if (qualifiedName.equals("java.lang.Double")) {
                return "Use the primitive double instead.";
            }
            if (!declared.getTypeArguments().isEmpty()) {
                return "Generic and collection types are not supported. " + supported;
            }
            if (element.getKind() == ElementKind.CLASS) {
                return "Annotate " + element.getSimpleName()
                        + " with @StringlyTyped or include it with @IncludeStringly.";
            }
        }
        return supported;
    }
}

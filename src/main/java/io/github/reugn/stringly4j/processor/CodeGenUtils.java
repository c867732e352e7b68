package io.github.reugn.stringly4j.processor;

import com.squareup.javapoet.ClassName;
import io.github.reugn.stringly4j.ValueType;

import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.PackageElement;
import javax.lang.model.element.TypeElement;
import javax.lang.model.element.VariableElement;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Shared utilities for accessor generation.
 *
 * <p><b>Naming:</b>
 * <table border="1">
 *   <caption>Generated accessor names</caption>
 *   <tr><th>Accessed type</th><th>Generated accessor</th></tr>
 *   <tr><td>{@code com.example.Outer}</td><td>{@code com.example.OuterAccessor}</td></tr>
 *   <tr><td>{@code com.example.Config.Network}</td><td>{@code com.example.Config_NetworkAccessor}</td></tr>
 * </table>
 *
 * @see AccessorGenerator
 */
final class CodeGenUtils {

    /**
     * Name of the singleton field in every generated accessor.
     */
    static final String INSTANCE_FIELD = "INSTANCE";

    private CodeGenUtils() {
    }

    /**
     * Computes the accessor class for a type.
     *
     * @param type          the accessed type
     * @param targetPackage the package the accessor is generated in
     * @param suffix        the accessor name suffix, usually {@code "Accessor"}
     * @return the accessor class name
     */
    static ClassName accessorName(TypeElement type, String targetPackage, String suffix) {
        Deque<String> names = new ArrayDeque<>();
        Element current = type;
        while (current != null && current.getKind() != ElementKind.PACKAGE) {
            names.addFirst(current.getSimpleName().toString());
            current = current.getEnclosingElement();
        }
        return ClassName.get(targetPackage, String.join("_", names) + suffix);
    }

    /**
     * Returns the package a type is declared in.
     *
     * @param type the type
     * @return the qualified package name; empty for the unnamed package
     */
    static String packageOf(TypeElement type) {
        Element current = type;
        while (current.getKind() != ElementKind.PACKAGE) {
            current = current.getEnclosingElement();
        }
        return ((PackageElement) current).getQualifiedName().toString();
    }

    // ==================== FIELD MODEL ====================

    /**
     * One field of an accessed type, resolved for generation.
     *
     * <p>Exactly one of {@code leaf} and {@code nested} is non-null.
     *
     * @param element the field declaration
     * @param leaf    the leaf type for {@code long}, {@code double} and {@code String} fields
     * @param nested  the accessor of the field's type for aggregate fields
     */
    record FieldInfo(VariableElement element, ValueType leaf, ClassName nested) {

        static FieldInfo leaf(VariableElement element, ValueType leaf) {
            return new FieldInfo(element, leaf, null);
        }

        static FieldInfo nested(VariableElement element, ClassName accessor) {
            return new FieldInfo(element, null, accessor);
        }

        String name() {
            return element.getSimpleName().toString();
        }

        boolean isLeaf() {
            return leaf != null;
        }
    }
}

package io.github.reugn.stringly4j.processor;

import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.FieldSpec;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import io.github.reugn.stringly4j.AccessException;
import io.github.reugn.stringly4j.AggregateAccessor;
import io.github.reugn.stringly4j.Leaf;
import io.github.reugn.stringly4j.Value;
import io.github.reugn.stringly4j.ValueType;

import javax.lang.model.element.Modifier;
import java.util.List;

import static io.github.reugn.stringly4j.processor.AccessorRegistry.AccessTarget;
import static io.github.reugn.stringly4j.processor.CodeGenUtils.FieldInfo;
import static io.github.reugn.stringly4j.processor.CodeGenUtils.INSTANCE_FIELD;

/**
 * Generates the accessor class of one aggregate type.
 *
 * <p>The accessor extends {@link AggregateAccessor} and contributes one delegation branch per
 * field, in declaration order:
 * <pre>{@code
 * @Generated("io.github.reugn.stringly4j.processor.StringlyProcessor")
 * public final class InnerAccessor extends AggregateAccessor<Inner> {
 *     public static final InnerAccessor INSTANCE = new InnerAccessor();
 *
 *     private InnerAccessor() {
 *         super("Inner", List.of("x", "y"));
 *     }
 *
 *     @Override
 *     protected Value getField(Inner target, String field, List<String> rest) throws AccessException {
 *         if (field.equals("x")) {
 *             return Leaf.DOUBLE.get(target.x, rest);
 *         }
 *         if (field.equals("y")) {
 *             return Leaf.INTEGER.get(target.y, rest);
 *         }
 *         throw unknownField(field);
 *     }
 *
 *     @Override
 *     protected void setField(Inner target, String field, List<String> rest, Value value)
 *             throws AccessException {
 *         if (field.equals("x")) {
 *             target.x = Leaf.DOUBLE.set(rest, value);
 *             return;
 *         }
 *         ...
 *         throw unknownField(field);
 *     }
 * }
 * }</pre>
 *
 * <p>Aggregate fields delegate to the nested type's {@code INSTANCE} through {@code getNested}
 * and {@code setNested}. Those, like the named {@code String} leaf read, check the path before
 * the field content, so an unset field fails with its name only when the path reaches into it.
 */
final class AccessorGenerator {

    private static final ClassName LEAF = ClassName.get(Leaf.class);
    private static final ClassName GENERATED = ClassName.get("javax.annotation.processing", "Generated");
    private static final TypeName PATH = ParameterizedTypeName.get(List.class, String.class);

    private AccessorGenerator() {
    }

    /**
     * Builds the source file of an accessor.
     *
     * @param target the accessed type and accessor name
     * @param fields the validated fields, in declaration order
     * @return the file, ready to be written to the filer
     */
    static JavaFile generate(AccessTarget target, List<FieldInfo> fields) {
        ClassName targetType = ClassName.get(target.type());
        ClassName accessorType = target.accessor();

        TypeSpec accessor = TypeSpec.classBuilder(accessorType)
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .superclass(ParameterizedTypeName.get(ClassName.get(AggregateAccessor.class), targetType))
                .addAnnotation(AnnotationSpec.builder(GENERATED)
                        .addMember("value", "$S", StringlyProcessor.class.getCanonicalName())
                        .build())
                .addJavadoc("Path accessor for {@link $T}.\n", targetType)
                .addJavadoc("<p>Generated by stringly4j annotation processor.\n")
                .addField(FieldSpec.builder(accessorType, INSTANCE_FIELD,
                                Modifier.PUBLIC, Modifier.STATIC, Modifier.FINAL)
                        .initializer("new $T()", accessorType)
                        .build())
                .addMethod(constructor(target, fields))
                .addMethod(getField(targetType, fields))
                .addMethod(setField(targetType, fields))
                .build();

        return JavaFile.builder(accessorType.packageName(), accessor)
                .addFileComment("Generated by stringly4j annotation processor. Do not modify.")
                .skipJavaLangImports(true)
                .build();
    }

    private static MethodSpec constructor(AccessTarget target, List<FieldInfo> fields) {
        CodeBlock names = CodeBlock.join(fields.stream()
                .map(field -> CodeBlock.of("$S", field.name()))
                .toList(), ", ");
        return MethodSpec.constructorBuilder()
                .addModifiers(Modifier.PRIVATE)
                .addStatement("super($S, $T.of($L))", target.type().getSimpleName().toString(), List.class, names)
                .build();
    }

    private static MethodSpec getField(ClassName targetType, List<FieldInfo> fields) {
        MethodSpec.Builder method = MethodSpec.methodBuilder("getField")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PROTECTED)
                .returns(Value.class)
                .addParameter(targetType, "target")
                .addParameter(String.class, "field")
                .addParameter(PATH, "rest")
                .addException(AccessException.class);

        for (FieldInfo field : fields) {
            method.beginControlFlow("if (field.equals($S))", field.name());
            if (field.isLeaf() && field.leaf() != ValueType.STRING) {
                method.addStatement("return $T.$L.get(target.$N, rest)", LEAF, field.leaf().name(), field.name());
            } else if (field.isLeaf()) {
                method.addStatement("return $T.$L.get(target.$N, $S, rest)",
                        LEAF, field.leaf().name(), field.name(), field.name());
            } else {
                method.addStatement("return getNested($T.$N, target.$N, $S, rest)",
                        field.nested(), INSTANCE_FIELD, field.name(), field.name());
            }
            method.endControlFlow();
        }

        return method.addStatement("throw unknownField(field)").build();
    }

    private static MethodSpec setField(ClassName targetType, List<FieldInfo> fields) {
        MethodSpec.Builder method = MethodSpec.methodBuilder("setField")
                .addAnnotation(Override.class)
                .addModifiers(Modifier.PROTECTED)
                .addParameter(targetType, "target")
                .addParameter(String.class, "field")
                .addParameter(PATH, "rest")
                .addParameter(Value.class, "value")
                .addException(AccessException.class);

        for (FieldInfo field : fields) {
            method.beginControlFlow("if (field.equals($S))", field.name());
            if (field.isLeaf()) {
                method.addStatement("target.$N = $T.$L.set(rest, value)", field.name(), LEAF, field.leaf().name());
            } else {
                method.addStatement("setNested($T.$N, target.$N, $S, rest, value)",
                        field.nested(), INSTANCE_FIELD, field.name(), field.name());
            }
            method.addStatement("return");
            method.endControlFlow();
        }

        return method.addStatement("throw unknownField(field)").build();
    }
}

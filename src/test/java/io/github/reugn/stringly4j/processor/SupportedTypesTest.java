package io.github.reugn.stringly4j.processor;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.JavaFileObjects;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaFileObject;
import java.nio.file.Path;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static io.github.reugn.stringly4j.util.CompileHelper.compile;
import static io.github.reugn.stringly4j.util.CompileHelper.compileAgainst;
import static io.github.reugn.stringly4j.util.CompileHelper.writeClassFiles;
import static org.junit.jupiter.api.Assertions.assertFalse;

/**
 * Tests for supported and unsupported field types.
 */
@DisplayName("Supported Field Types")
class SupportedTypesTest {

    private static JavaFileObject singleField(String declaration) {
        return JavaFileObjects.forSourceString("test.Holder", """
                package test;
                
                import io.github.reugn.stringly4j.annotation.StringlyTyped;
                
                @StringlyTyped
                public class Holder {
                    %s
                }
                """.formatted(declaration));
    }

    @Nested
    @DisplayName("Leaf Types")
    class LeafTypes {

        @Test
        @DisplayName("long maps to the integer leaf")
        void longField() {
            Compilation compilation = compile(singleField("long count;"));
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.HolderAccessor")
                    .contentsAsUtf8String().contains("return Leaf.INTEGER.get(target.count, rest);");
        }

        @Test
        @DisplayName("double maps to the double leaf")
        void doubleField() {
            Compilation compilation = compile(singleField("double ratio;"));
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.HolderAccessor")
                    .contentsAsUtf8String().contains("target.ratio = Leaf.DOUBLE.set(rest, value);");
        }

        @Test
        @DisplayName("String maps to the string leaf and is null-checked on read")
        void stringField() {
            Compilation compilation = compile(singleField("String name;"));
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.HolderAccessor")
                    .contentsAsUtf8String()
                    .contains("return Leaf.STRING.get(target.name, \"name\", rest);");
        }
    }

    @Nested
    @DisplayName("Unsupported Types")
    class UnsupportedTypes {

        @Test
        @DisplayName("int suggests long")
        void intField() {
            Compilation compilation = compile(singleField("int count;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Field 'count' has unsupported type int. Use long instead.");
        }

        @Test
        @DisplayName("short and byte suggest long")
        void narrowIntegers() {
            Compilation compilation = compile(singleField("short a; byte b;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Field 'a' has unsupported type short. Use long instead.");
            assertThat(compilation).hadErrorContaining("Field 'b' has unsupported type byte. Use long instead.");
        }

        @Test
        @DisplayName("float suggests double")
        void floatField() {
            Compilation compilation = compile(singleField("float ratio;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Use double instead.");
        }

        @Test
        @DisplayName("Boxed Long and Double suggest primitives")
        void boxedFields() {
            Compilation compilation = compile(singleField("Long a; Double b;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Use the primitive long instead.");
            assertThat(compilation).hadErrorContaining("Use the primitive double instead.");
        }

        @Test
        @DisplayName("boolean and char are rejected")
        void otherPrimitives() {
            Compilation compilation = compile(singleField("boolean flag; char letter;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Field 'flag' has unsupported type boolean.");
            assertThat(compilation).hadErrorContaining("Field 'letter' has unsupported type char.");
        }

        @Test
        @DisplayName("Collections are rejected")
        void collectionField() {
            Compilation compilation = compile(singleField("java.util.List<String> names;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Generic and collection types are not supported.");
        }

        @Test
        @DisplayName("Arrays are rejected")
        void arrayField() {
            Compilation compilation = compile(singleField("long[] values;"));
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining("Field 'values' has unsupported type long[].");
        }

        @Test
        @DisplayName("Unannotated class suggests annotating or including it")
        void unannotatedClass() {
            JavaFileObject plain = JavaFileObjects.forSourceString("test.Plain", """
                    package test;
                    
                    public class Plain {
                        long value;
                    }
                    """);
            JavaFileObject holder = singleField("Plain plain;");

            Compilation compilation = compile(plain, holder);
            assertThat(compilation).failed();
            assertThat(compilation).hadErrorContaining(
                    "Annotate Plain with @StringlyTyped or include it with @IncludeStringly.");
        }
    }

    @Nested
    @DisplayName("Aggregate Types")
    class AggregateTypes {

        @Test
        @DisplayName("Annotated field type delegates to its accessor")
        void annotatedFieldType() {
            JavaFileObject inner = JavaFileObjects.forSourceString("test.Inner", """
                    package test;
                    
                    import io.github.reugn.stringly4j.annotation.StringlyTyped;
                    
                    @StringlyTyped
                    public class Inner {
                        double x;
                        long y;
                    }
                    """);
            JavaFileObject outer = JavaFileObjects.forSourceString("test.Outer", """
                    package test;
                    
                    import io.github.reugn.stringly4j.annotation.StringlyTyped;
                    
                    @StringlyTyped
                    public class Outer {
                        public Inner inner;
                    }
                    """);

            Compilation compilation = compile(outer, inner);
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.OuterAccessor")
                    .contentsAsUtf8String()
                    .contains("return getNested(InnerAccessor.INSTANCE, target.inner, \"inner\", rest);");
            assertThat(compilation).generatedSourceFile("test.OuterAccessor")
                    .contentsAsUtf8String()
                    .contains("setNested(InnerAccessor.INSTANCE, target.inner, \"inner\", rest, value);");
            assertThat(compilation).generatedSourceFile("test.InnerAccessor");
        }

        @Test
        @DisplayName("Annotated type compiled earlier is resolved from the class path")
        void annotatedTypeOnClassPath(@TempDir Path classes) {
            JavaFileObject inner = JavaFileObjects.forSourceString("test.Inner", """
                    package test;
                    
                    import io.github.reugn.stringly4j.annotation.StringlyTyped;
                    
                    @StringlyTyped
                    public class Inner {
                        long y;
                    }
                    """);
            Compilation first = compile(inner);
            assertThat(first).succeeded();
            writeClassFiles(first, classes);

            JavaFileObject outer = JavaFileObjects.forSourceString("test.Outer", """
                    package test;
                    
                    import io.github.reugn.stringly4j.annotation.StringlyTyped;
                    
                    @StringlyTyped
                    public class Outer {
                        public Inner inner;
                    }
                    """);
            Compilation second = compileAgainst(classes, outer);
            assertThat(second).succeeded();
            assertThat(second).generatedSourceFile("test.OuterAccessor")
                    .contentsAsUtf8String()
                    .contains("return getNested(InnerAccessor.INSTANCE, target.inner, \"inner\", rest);");
            assertFalse(second.generatedSourceFile("test.InnerAccessor").isPresent());
        }

        @Test
        @DisplayName("Self-referencing type is supported")
        void recursiveType() {
            Compilation compilation = compile(singleField("long value; Holder next;"));
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.HolderAccessor")
                    .contentsAsUtf8String()
                    .contains("return getNested(HolderAccessor.INSTANCE, target.next, \"next\", rest);");
        }

        @Test
        @DisplayName("Fields keep declaration order")
        void declarationOrder() {
            Compilation compilation = compile(singleField("String z; long a; double m;"));
            assertThat(compilation).succeeded();
            assertThat(compilation).generatedSourceFile("test.HolderAccessor")
                    .contentsAsUtf8String().contains("super(\"Holder\", List.of(\"z\", \"a\", \"m\"));");
        }
    }
}

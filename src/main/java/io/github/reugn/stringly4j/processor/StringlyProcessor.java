package io.github.reugn.stringly4j.processor;

import com.google.auto.service.AutoService;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import io.github.reugn.stringly4j.annotation.IncludeStringly;
import io.github.reugn.stringly4j.annotation.StringlyTyped;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Messager;
import javax.annotation.processing.ProcessingEnvironment;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.annotation.processing.SupportedSourceVersion;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.TypeElement;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.github.reugn.stringly4j.processor.AccessorRegistry.AccessTarget;
import static io.github.reugn.stringly4j.processor.CodeGenUtils.FieldInfo;

/**
 * Main annotation processor for stringly4j: generates path accessors for aggregate classes.
 *
 * <p>Registered via {@link com.google.auto.service.AutoService} for automatic discovery by the
 * Java compiler.
 *
 * <p><b>Supported Annotations:</b>
 * <table border="1">
 *   <caption>Annotations processed by this processor</caption>
 *   <tr><th>Annotation</th><th>Target</th><th>Purpose</th></tr>
 *   <tr>
 *     <td>{@link StringlyTyped}</td>
 *     <td>Class</td>
 *     <td>Generates an accessor for the annotated class</td>
 *   </tr>
 *   <tr>
 *     <td>{@link IncludeStringly}</td>
 *     <td>Class</td>
 *     <td>Generates accessors for external classes you cannot modify</td>
 *   </tr>
 * </table>
 *
 * <p><b>Generated Output:</b>
 * <pre>
 * {@code // Source
 * @StringlyTyped
 * public class Inner {
 *     double x;
 *     long y;
 * }
 *
 * // Generated: InnerAccessor.java
 * public final class InnerAccessor extends AggregateAccessor<Inner> {
 *     public static final InnerAccessor INSTANCE = new InnerAccessor();
 *     ...
 * }}
 * </pre>
 *
 * <p><b>Processing Pipeline:</b>
 * <ol>
 *   <li><b>Collection</b> - register every annotated and included type of the round, so
 *       types of the same compilation can nest each other</li>
 *   <li><b>Validation</b> - check each type and its fields via {@link ValidationUtils}</li>
 *   <li><b>Generation</b> - write one accessor per valid type via {@link AccessorGenerator}</li>
 * </ol>
 *
 * <p>Options are described in {@link ProcessorOptions}.
 *
 * @see AccessorGenerator
 * @see ValidationUtils
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "io.github.reugn.stringly4j.annotation.StringlyTyped",
        "io.github.reugn.stringly4j.annotation.IncludeStringly"
})
@SupportedSourceVersion(SourceVersion.RELEASE_17)
public class StringlyProcessor extends AbstractProcessor {

    private ErrorReporter errorReporter;
    private ProcessorOptions options;

    /**
     * Creates a new StringlyProcessor instance.
     *
     * <p>Required for {@link java.util.ServiceLoader} discovery; the processor is not usable until
     * {@link #init(ProcessingEnvironment)} is called by the compiler.
     */
    public StringlyProcessor() {
    }

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        Messager messager = processingEnv.getMessager();
        this.errorReporter = (element, message) -> messager.printMessage(Diagnostic.Kind.ERROR, message, element);
        this.options = ProcessorOptions.parse(processingEnv.getOptions(), messager);
    }

    @Override
    public Set<String> getSupportedOptions() {
        return ProcessorOptions.KEYS;
    }

    /**
     * Processes {@code @StringlyTyped} and {@code @IncludeStringly} annotations.
     *
     * <p>Errors are reported via the {@link Messager}; processing continues so that as many
     * problems as possible surface in a single compilation. A type with errors gets no accessor.
     *
     * @param annotations the annotation types being processed in this round
     * @param roundEnv    the environment for this processing round
     * @return {@code true} to claim the annotations
     */
    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        AccessorRegistry registry = collect(roundEnv);

        Map<ClassName, AccessTarget> generatedNames = new HashMap<>();
        for (AccessTarget target : registry.targets()) {
            AccessTarget clash = generatedNames.putIfAbsent(target.accessor(), target);
            if (clash != null) {
                errorReporter.error(target.origin(), "Accessor name conflict: " + target.type().getQualifiedName()
                        + " and " + clash.type().getQualifiedName() + " would both generate " + target.accessor()
                        + ". Include one of them from another package.");
                continue;
            }

            List<FieldInfo> fields = ValidationUtils.collectFields(target, registry, errorReporter);
            if (fields == null) {
                continue; // Errors already reported
            }

            try {
                write(target, fields);
            } catch (IOException e) {
                errorReporter.error(target.origin(), "Failed to generate accessor " + target.accessor()
                        + ": " + e.getMessage());
            }
        }

        return true;
    }

    // ==================== COLLECTION ====================

    /**
     * Registers every type of the round that needs an accessor.
     *
     * <p>Annotated types are registered before included ones so that including an annotated
     * type is detected regardless of source order.
     *
     * @param roundEnv the round environment
     * @return the registry holding all targets, in registration order
     */
    private AccessorRegistry collect(RoundEnvironment roundEnv) {
        AccessorRegistry registry = new AccessorRegistry(options.suffix());

        for (Element element : roundEnv.getElementsAnnotatedWith(StringlyTyped.class)) {
            if (ValidationUtils.validateAnnotatedKind(element, errorReporter)) {
                registry.addAnnotated((TypeElement) element);
            }
        }

        IncludeCollector includes = new IncludeCollector(registry, errorReporter);
        for (Element element : roundEnv.getElementsAnnotatedWith(IncludeStringly.class)) {
            includes.collect((TypeElement) element);
        }

        return registry;
    }

    // ==================== GENERATION ====================

    private void write(AccessTarget target, List<FieldInfo> fields) throws IOException {
        JavaFile file = AccessorGenerator.generate(target, fields);
        file.writeTo(processingEnv.getFiler());

        if (options.verbose()) {
            processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                    "Generated " + target.accessor() + " for " + target.type().getQualifiedName()
                            + " (" + fields.size() + (fields.size() == 1 ? " field)" : " fields)"),
                    target.origin());
        }
    }
}

package io.github.reugn.stringly4j.processor;

import javax.annotation.processing.Messager;
import javax.lang.model.SourceVersion;
import javax.tools.Diagnostic;
import java.util.Map;
import java.util.Set;

/**
 * Compiler options understood by {@link StringlyProcessor}, passed as {@code -Akey=value}.
 *
 * <table border="1">
 *   <caption>Supported options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Effect</th></tr>
 *   <tr>
 *     <td>{@code stringly4j.verbose}</td>
 *     <td>{@code false}</td>
 *     <td>Print a note for every generated accessor</td>
 *   </tr>
 *   <tr>
 *     <td>{@code stringly4j.suffix}</td>
 *     <td>{@code Accessor}</td>
 *     <td>Suffix of generated class names</td>
 *   </tr>
 * </table>
 *
 * @param verbose whether to print a note per generated accessor
 * @param suffix  the generated class name suffix
 */
record ProcessorOptions(boolean verbose, String suffix) {

    static final String VERBOSE = "stringly4j.verbose";
    static final String SUFFIX = "stringly4j.suffix";
    static final String DEFAULT_SUFFIX = "Accessor";

    /**
     * All option keys, for {@link javax.annotation.processing.Processor#getSupportedOptions()}.
     */
    static final Set<String> KEYS = Set.of(VERBOSE, SUFFIX);

    /**
     * Reads the options, reporting invalid values as errors and falling back to defaults.
     *
     * @param options  the raw options from the processing environment
     * @param messager where to report invalid values
     * @return the parsed options
     */
    static ProcessorOptions parse(Map<String, String> options, Messager messager) {
        boolean verbose = Boolean.parseBoolean(options.getOrDefault(VERBOSE, "false"));

        String suffix = options.getOrDefault(SUFFIX, DEFAULT_SUFFIX);
        if (suffix.isEmpty() || !SourceVersion.isIdentifier("A" + suffix)) {
            messager.printMessage(Diagnostic.Kind.ERROR,
                    "Invalid -A" + SUFFIX + "='" + suffix + "'. The suffix must be a non-empty part of a "
                            + "Java identifier. Using '" + DEFAULT_SUFFIX + "'.");
            suffix = DEFAULT_SUFFIX;
        }

        return new ProcessorOptions(verbose, suffix);
    }
}

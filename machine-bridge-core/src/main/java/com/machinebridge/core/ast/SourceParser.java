package com.machinebridge.core.ast;

import java.util.Set;

/**
 * Capability interface over a host source-language parser.
 *
 * <p>Implementations turn source text into a {@link SourceFile}: they locate machine factory
 * calls and expose their arguments as {@link JsAst} literal trees with source ranges. The
 * extraction and patch engines depend only on this interface and the {@link JsAst} model,
 * never on a concrete parser.
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.machinebridge.core.ast.SourceParser}
 *
 * @see SourceParsers
 */
public interface SourceParser {

    /**
     * Default factory function name recognised as a machine call site.
     */
    String DEFAULT_FACTORY_NAME = "createMachine";

    /**
     * Returns unique identifier for this parser (e.g. "javascript").
     *
     * @return parser identifier
     */
    String getId();

    /**
     * Returns file extensions (without dot) this parser handles.
     *
     * @return supported extensions
     */
    Set<String> getSupportedExtensions();

    /**
     * Parses a file, locating calls to the default factory name.
     *
     * @param fileName file name used for reporting and edits
     * @param text full source text
     * @return parsed file (never null)
     */
    default SourceFile parse(String fileName, String text) {
        return parse(fileName, text, Set.of(DEFAULT_FACTORY_NAME));
    }

    /**
     * Parses a file, locating calls to any of the given factory names.
     *
     * @param fileName file name used for reporting and edits
     * @param text full source text
     * @param factoryNames function names treated as machine factories
     * @return parsed file (never null)
     */
    SourceFile parse(String fileName, String text, Set<String> factoryNames);

    /**
     * Returns true if this parser handles the given file name.
     *
     * @param fileName file name or path
     * @return true if the extension is supported
     */
    default boolean supports(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        if (lastDot < 0) {
            return false;
        }
        return getSupportedExtensions().contains(fileName.substring(lastDot + 1).toLowerCase());
    }
}

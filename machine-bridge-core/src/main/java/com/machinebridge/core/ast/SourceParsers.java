package com.machinebridge.core.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of {@link SourceParser} implementations discovered through {@link ServiceLoader}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceParser parser = SourceParsers.forFile("machine.ts")
 *     .orElseThrow(() -> new IllegalArgumentException("No parser for machine.ts"));
 * SourceFile file = parser.parse("machine.ts", text);
 * }</pre>
 */
public final class SourceParsers {

    private static final Logger log = LoggerFactory.getLogger(SourceParsers.class);

    private static final List<SourceParser> PARSERS = loadParsers();

    private SourceParsers() {
        // Utility class - no instantiation
    }

    /**
     * Returns all registered parsers in discovery order.
     *
     * @return registered parsers
     */
    public static List<SourceParser> all() {
        return PARSERS;
    }

    /**
     * Returns the first parser that supports the given file name.
     *
     * @param fileName file name or path
     * @return parser, or empty if none handles the extension
     */
    public static Optional<SourceParser> forFile(String fileName) {
        return PARSERS.stream()
            .filter(parser -> parser.supports(fileName))
            .findFirst();
    }

    private static List<SourceParser> loadParsers() {
        List<SourceParser> parsers = ServiceLoader.load(SourceParser.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        log.debug("Discovered {} source parser(s): {}", parsers.size(),
            parsers.stream().map(SourceParser::getId).toList());
        return parsers;
    }
}

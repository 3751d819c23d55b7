package com.machinebridge.core.ast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link SourceProgram} over an in-memory set of file texts.
 *
 * <p>Files are parsed lazily on first access with the parser registered for their extension and
 * the parse result is cached. Files without a registered parser are reported as absent.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SourceProgram program = InMemorySourceProgram.of(Map.of("machine.ts", text));
 * MachineProject project = new MachineProject(program);
 * }</pre>
 */
public final class InMemorySourceProgram implements SourceProgram {

    private static final Logger log = LoggerFactory.getLogger(InMemorySourceProgram.class);

    private final Map<String, String> texts;
    private final Set<String> factoryNames;
    private final Map<String, SourceFile> parsed = new ConcurrentHashMap<>();

    private InMemorySourceProgram(Map<String, String> texts, Set<String> factoryNames) {
        this.texts = Map.copyOf(texts);
        this.factoryNames = Set.copyOf(factoryNames);
        if (this.factoryNames.isEmpty()) {
            throw new IllegalArgumentException("At least one factory name required");
        }
    }

    /**
     * Creates a program recognising the default {@code createMachine} factory.
     *
     * @param texts file name to source text
     * @return new program
     */
    public static InMemorySourceProgram of(Map<String, String> texts) {
        return new InMemorySourceProgram(texts, Set.of(SourceParser.DEFAULT_FACTORY_NAME));
    }

    /**
     * Creates a program recognising the given factory names.
     *
     * @param texts file name to source text
     * @param factoryNames function names treated as machine factories
     * @return new program
     */
    public static InMemorySourceProgram of(Map<String, String> texts, Collection<String> factoryNames) {
        return new InMemorySourceProgram(texts, Set.copyOf(factoryNames));
    }

    /**
     * Reads the given files from disk. Each file is registered under its path string.
     *
     * @param files files to read
     * @param factoryNames function names treated as machine factories
     * @return new program
     * @throws IOException if a file cannot be read
     */
    public static InMemorySourceProgram fromFiles(Collection<Path> files, Collection<String> factoryNames) throws IOException {
        Map<String, String> texts = new LinkedHashMap<>();
        for (Path file : files) {
            texts.put(file.toString(), Files.readString(file));
        }
        return new InMemorySourceProgram(texts, Set.copyOf(factoryNames));
    }

    /**
     * Returns a new program with one file's text replaced; other parse results are not shared.
     *
     * @param fileName file to replace
     * @param text new text
     * @return new program
     */
    public InMemorySourceProgram withFile(String fileName, String text) {
        Objects.requireNonNull(fileName, "fileName must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Map<String, String> updated = new LinkedHashMap<>(texts);
        updated.put(fileName, text);
        return new InMemorySourceProgram(updated, factoryNames);
    }

    @Override
    public Optional<SourceFile> getSourceFile(String fileName) {
        String text = texts.get(fileName);
        if (text == null) {
            return Optional.empty();
        }
        Optional<SourceParser> parser = SourceParsers.forFile(fileName);
        if (parser.isEmpty()) {
            log.warn("No source parser registered for file: {}", fileName);
            return Optional.empty();
        }
        return Optional.of(parsed.computeIfAbsent(fileName, name -> {
            log.debug("Parsing {} with parser '{}'", name, parser.get().getId());
            return parser.get().parse(name, text, factoryNames);
        }));
    }
}

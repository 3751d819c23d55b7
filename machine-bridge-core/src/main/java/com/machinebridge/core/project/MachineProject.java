package com.machinebridge.core.project;

import com.machinebridge.core.ast.FactoryCall;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.ast.SourceProgram;
import com.machinebridge.core.extraction.MachineExtractor;
import com.machinebridge.core.model.LineAndCharacter;
import com.machinebridge.core.model.LineAndCharacterRange;
import com.machinebridge.core.model.MachineExtraction;
import com.machinebridge.core.model.TextEdit;
import com.machinebridge.core.model.TextRange;
import com.machinebridge.core.patch.Patch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for tools working with the machines of a {@link SourceProgram}.
 *
 * <p>Keeps one {@link ProjectMachine} per (file, machine index). Extraction state is kept across
 * {@link #updateProgram(SourceProgram)} and checked against the new program when it is next
 * used. Patches are only accepted for a machine extracted from the file's current text.
 *
 * <p>Instances are not thread-safe; each request runs to completion before the next.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * MachineProject project = new MachineProject(InMemorySourceProgram.of(Map.of("m.ts", text)));
 * List<MachineExtraction> machines = project.getMachinesInFile("m.ts");
 * List<TextEdit> edits = project.applyPatches("m.ts", 0, patches);
 * String updated = TextEdits.apply(text, edits);
 * }</pre>
 */
public class MachineProject {

    private static final Logger log = LoggerFactory.getLogger(MachineProject.class);

    private final MachineExtractor extractor;
    private final Map<String, List<ProjectMachine>> machines = new HashMap<>();
    private SourceProgram program;

    public MachineProject(SourceProgram program) {
        this(program, new MachineExtractor());
    }

    public MachineProject(SourceProgram program, MachineExtractor extractor) {
        this.program = Objects.requireNonNull(program, "program must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
    }

    /**
     * Returns the range of every machine factory call of a file, in file order.
     *
     * @param fileName file name
     * @return call ranges, empty if the program has no such file
     */
    public List<TextRange> findMachines(String fileName) {
        return program.getSourceFile(fileName)
            .map(file -> file.factoryCalls().stream().map(FactoryCall::range).toList())
            .orElseGet(List::of);
    }

    /**
     * Extracts every machine of a file.
     *
     * <p>The machine at position {@code i} of the result is addressed by machine index {@code i}
     * in {@link #applyPatches(String, int, List)}.
     *
     * @param fileName file name
     * @return one extraction per factory call, empty if the program has no such file
     */
    public List<MachineExtraction> getMachinesInFile(String fileName) {
        Optional<SourceFile> file = program.getSourceFile(fileName);
        if (file.isEmpty()) {
            log.warn("File not found in program: {}", fileName);
            machines.remove(fileName);
            return List.of();
        }

        int count = file.get().factoryCalls().size();
        List<ProjectMachine> cached = machines.computeIfAbsent(fileName, name -> new ArrayList<>());
        while (cached.size() > count) {
            cached.remove(cached.size() - 1);
        }
        while (cached.size() < count) {
            cached.add(new ProjectMachine(fileName, cached.size(), extractor));
        }

        List<MachineExtraction> extractions = new ArrayList<>(count);
        for (ProjectMachine machine : cached) {
            extractions.add(machine.extract(program));
        }
        log.info("Extracted {} machine(s) from {}", count, fileName);
        return extractions;
    }

    /**
     * Applies patches to a machine extracted by {@link #getMachinesInFile(String)}.
     *
     * @param fileName file name
     * @param machineIndex machine index
     * @param patches patches in order
     * @return text edits against the current text of the file, in ascending offset order
     * @throws MachineNotFoundException if the machine was never extracted or no longer exists
     * @throws SourceFileNotFoundException if the program no longer contains the file
     * @throws StaleMachineStateException if the file changed since the machine was extracted
     */
    public List<TextEdit> applyPatches(String fileName, int machineIndex, List<Patch> patches) {
        List<ProjectMachine> cached = machines.get(fileName);
        if (cached == null || machineIndex < 0 || machineIndex >= cached.size()) {
            throw new MachineNotFoundException(fileName, machineIndex);
        }
        return cached.get(machineIndex).applyPatches(program, patches);
    }

    /**
     * Returns the machine tracked for a file and index, if it was extracted.
     */
    public Optional<ProjectMachine> getMachine(String fileName, int machineIndex) {
        List<ProjectMachine> cached = machines.get(fileName);
        if (cached == null || machineIndex < 0 || machineIndex >= cached.size()) {
            return Optional.empty();
        }
        return Optional.of(cached.get(machineIndex));
    }

    /**
     * Swaps the program used by subsequent requests. Tracked machines are kept.
     *
     * @param program new program snapshot
     */
    public void updateProgram(SourceProgram program) {
        this.program = Objects.requireNonNull(program, "program must not be null");
        log.debug("Program updated, {} file(s) tracked", machines.size());
    }

    public LineAndCharacter getLineAndCharacterOfPosition(String fileName, int position) {
        return requireFile(fileName).lineAndCharacterOf(position);
    }

    public LineAndCharacterRange getLinesAndCharactersRange(String fileName, TextRange range) {
        return requireFile(fileName).lineAndCharacterRangeOf(range);
    }

    private SourceFile requireFile(String fileName) {
        return program.getSourceFile(fileName).orElseThrow(() -> new SourceFileNotFoundException(fileName));
    }
}

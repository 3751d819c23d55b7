package com.machinebridge.core.project;

import com.machinebridge.core.ast.FactoryCall;
import com.machinebridge.core.ast.JsAst;
import com.machinebridge.core.ast.SourceFile;
import com.machinebridge.core.ast.SourceProgram;
import com.machinebridge.core.extraction.MachineExtractor;
import com.machinebridge.core.model.MachineExtraction;
import com.machinebridge.core.model.TextEdit;
import com.machinebridge.core.patch.Patch;
import com.machinebridge.core.patch.PatchApplier;
import com.machinebridge.core.patch.PatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * One machine of a file, addressed by its position among the file's factory calls.
 *
 * <p>The call is looked up by that position on every access, so the machine survives a reparse
 * of its file as long as calls are not reordered.
 */
public final class ProjectMachine {

    private static final Logger log = LoggerFactory.getLogger(ProjectMachine.class);

    private final String fileName;
    private final int machineIndex;
    private final MachineExtractor extractor;
    private ProjectMachineState state;

    ProjectMachine(String fileName, int machineIndex, MachineExtractor extractor) {
        this.fileName = fileName;
        this.machineIndex = machineIndex;
        this.extractor = extractor;
    }

    public String fileName() {
        return fileName;
    }

    public int machineIndex() {
        return machineIndex;
    }

    /**
     * Returns the state of the last extraction, with patches applied since.
     */
    public Optional<ProjectMachineState> state() {
        return Optional.ofNullable(state);
    }

    MachineExtraction extract(SourceProgram program) {
        SourceFile file = sourceFile(program);
        call(file);
        state = ProjectMachineState.of(extractor.extract(file, machineIndex), file.text());
        return state.toMachineExtraction();
    }

    List<TextEdit> applyPatches(SourceProgram program, List<Patch> patches) {
        if (state == null) {
            throw new MachineNotFoundException(fileName, machineIndex);
        }
        SourceFile file = sourceFile(program);
        FactoryCall call = call(file);
        if (!file.text().equals(state.sourceText())) {
            throw new StaleMachineStateException(fileName, machineIndex);
        }
        JsAst.Expression config = call.config()
            .orElseThrow(() -> new IllegalStateException("Machine " + fileName + " #" + machineIndex + " has no configuration"));

        PatchResult result = new PatchApplier(file, config, state.locators(), state.idMap())
            .apply(state.digraph(), patches);
        state = state.withDigraph(result.digraph());
        log.info("Applied {} patch(es) to {} #{}: {} edit(s)", patches.size(), fileName, machineIndex, result.edits().size());
        return result.edits();
    }

    private SourceFile sourceFile(SourceProgram program) {
        return program.getSourceFile(fileName).orElseThrow(() -> new SourceFileNotFoundException(fileName));
    }

    private FactoryCall call(SourceFile file) {
        if (machineIndex >= file.factoryCalls().size()) {
            throw new MachineNotFoundException(fileName, machineIndex);
        }
        return file.factoryCalls().get(machineIndex);
    }
}

package com.machinebridge.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.machinebridge.core.codechange.TextEdits;
import com.machinebridge.core.config.ProjectConfig;
import com.machinebridge.core.model.TextEdit;
import com.machinebridge.core.project.MachineProject;
import com.machinebridge.core.patch.Patch;
import com.machinebridge.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Applies a JSON array of digraph patches to one machine of a file.
 *
 * <p>By default the resulting text edits are printed as JSON. With {@code --write} (or
 * {@code patch.writeInPlace} in configuration) the edits are applied and the file is rewritten.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * machine-bridge patch src/machine.ts --index 0 --patches patches.json
 * machine-bridge patch src/machine.ts --patches patches.json --write
 * }</pre>
 */
@Command(
    name = "patch",
    description = "Apply digraph patches to a machine and emit text edits",
    mixinStandardHelpOptions = true
)
public class PatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PatchCommand.class);
    private static final TypeReference<List<Patch>> PATCH_LIST = new TypeReference<>() {
    };

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JavaScript or TypeScript source file")
    private Path file;

    @Option(
        names = {"-i", "--index"},
        description = "Machine index (default: 0)",
        defaultValue = "0"
    )
    private int machineIndex;

    @Option(
        names = {"-p", "--patches"},
        description = "JSON file holding an array of patches",
        required = true
    )
    private Path patchesFile;

    @Option(
        names = {"-w", "--write"},
        description = "Rewrite the source file instead of printing edits"
    )
    private boolean write;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: machinebridge.yaml)"
    )
    private Path configPath = Paths.get("machinebridge.yaml");

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            ProjectConfig config = MachineFiles.loadConfiguration(configPath);
            MachineProject project = MachineFiles.openProject(file, config);
            String fileName = file.toString();

            ObjectMapper mapper = JsonMappers.standard();
            List<Patch> patches = mapper.readValue(patchesFile.toFile(), PATCH_LIST);
            log.info("Applying {} patch(es) to machine {} of {}", patches.size(), machineIndex, fileName);

            project.getMachinesInFile(fileName);
            List<TextEdit> edits = project.applyPatches(fileName, machineIndex, patches);

            if (write || config.patch().writeInPlace()) {
                String original = Files.readString(file);
                Files.writeString(file, TextEdits.apply(original, edits));
                out.println("✓ Applied " + edits.size() + " edit(s) to " + fileName);
            } else {
                boolean pretty = config.output().pretty();
                out.println(pretty
                    ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(edits)
                    : mapper.writeValueAsString(edits));
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Patch failed", e);
            spec.commandLine().getErr().println("✗ Patch failed: " + e.getMessage());
            return 1;
        }
    }
}

package com.machinebridge.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.machinebridge.core.config.ProjectConfig;
import com.machinebridge.core.model.MachineExtraction;
import com.machinebridge.core.model.TextRange;
import com.machinebridge.core.project.MachineNotFoundException;
import com.machinebridge.core.project.MachineProject;
import com.machinebridge.core.util.JsonMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Extracts the machines of a file and prints them as JSON.
 *
 * <p>Without {@code --index} every machine is printed as a JSON array of
 * {@link MachineReport}s; with it, the single selected report is printed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * machine-bridge extract src/machine.ts --pretty
 * machine-bridge extract src/machine.ts --index 1
 * }</pre>
 */
@Command(
    name = "extract",
    description = "Extract machine digraphs from a file as JSON",
    mixinStandardHelpOptions = true
)
public class ExtractCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExtractCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JavaScript or TypeScript source file")
    private Path file;

    @Option(
        names = {"-i", "--index"},
        description = "Machine index (default: all machines)"
    )
    private Integer machineIndex;

    @Option(
        names = {"--pretty"},
        description = "Indent JSON output (overrides config)"
    )
    private boolean pretty;

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

            List<TextRange> ranges = project.findMachines(fileName);
            List<MachineExtraction> extractions = project.getMachinesInFile(fileName);
            boolean includeErrors = config.output().includeErrors();

            List<MachineReport> reports = new ArrayList<>(extractions.size());
            for (int i = 0; i < extractions.size(); i++) {
                MachineExtraction extraction = extractions.get(i);
                TextRange range = ranges.get(i);
                reports.add(new MachineReport(
                    i,
                    range,
                    project.getLinesAndCharactersRange(fileName, range),
                    extraction.digraph(),
                    includeErrors ? extraction.errors() : null));
                if (!extraction.errors().isEmpty()) {
                    log.warn("Machine {} of {} extracted with {} error(s)", i, fileName, extraction.errors().size());
                }
            }

            ObjectMapper mapper = JsonMappers.standard();
            ObjectWriter writer = pretty || config.output().pretty()
                ? mapper.writerWithDefaultPrettyPrinter()
                : mapper.writer();

            if (machineIndex != null) {
                if (machineIndex < 0 || machineIndex >= reports.size()) {
                    throw new MachineNotFoundException(fileName, machineIndex);
                }
                out.println(writer.writeValueAsString(reports.get(machineIndex)));
            } else {
                out.println(writer.writeValueAsString(reports));
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Extraction failed", e);
            spec.commandLine().getErr().println("✗ Extraction failed: " + e.getMessage());
            return 1;
        }
    }
}

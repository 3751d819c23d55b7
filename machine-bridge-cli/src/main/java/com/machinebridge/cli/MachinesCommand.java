package com.machinebridge.cli;

import com.machinebridge.core.config.ProjectConfig;
import com.machinebridge.core.model.LineAndCharacterRange;
import com.machinebridge.core.model.TextRange;
import com.machinebridge.core.project.MachineProject;
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
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Lists the machine factory calls of a file.
 *
 * <p>Each call is printed with its machine index, offsets and 1-based line and column.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * machine-bridge machines src/machine.ts
 * }</pre>
 */
@Command(
    name = "machines",
    description = "List machine factory calls in a file",
    mixinStandardHelpOptions = true
)
public class MachinesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MachinesCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "JavaScript or TypeScript source file")
    private Path file;

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
            log.info("Found {} machine(s) in {}", ranges.size(), fileName);

            if (ranges.isEmpty()) {
                out.println("No machines found in " + fileName);
                out.flush();
                return 0;
            }

            out.println("Machines in " + fileName + ":");
            out.println();
            for (int i = 0; i < ranges.size(); i++) {
                TextRange range = ranges.get(i);
                LineAndCharacterRange lines = project.getLinesAndCharactersRange(fileName, range);
                out.printf("  [%d] offsets %d-%d, lines %d:%d-%d:%d%n",
                    i, range.start(), range.end(),
                    lines.start().line() + 1, lines.start().character() + 1,
                    lines.end().line() + 1, lines.end().character() + 1);
            }
            out.flush();
            return 0;

        } catch (Exception e) {
            log.error("Listing machines failed", e);
            spec.commandLine().getErr().println("✗ Listing machines failed: " + e.getMessage());
            return 1;
        }
    }
}

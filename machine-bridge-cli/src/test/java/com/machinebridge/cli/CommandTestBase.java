package com.machinebridge.cli;

import com.machinebridge.MachineBridgeCLI;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for command tests. Runs the full command line with captured output streams and a
 * configuration path inside the temporary directory.
 */
public abstract class CommandTestBase {

    protected static final String MACHINE = """
        import { createMachine } from "xstate";

        export const light = createMachine({
          id: "light",
          initial: "green",
          states: {
            green: { on: { TIMER: "yellow" } },
            yellow: { on: { TIMER: "red" } },
            red: { on: { TIMER: "green" } },
          },
        });
        """;

    @TempDir
    protected Path tempDir;

    protected StringWriter out;
    protected StringWriter err;

    /**
     * Writes a source file into the temporary directory.
     */
    protected Path writeSource(String name, String text) throws IOException {
        return Files.writeString(tempDir.resolve(name), text);
    }

    /**
     * Path of a configuration file inside the temporary directory, not created unless written.
     */
    protected Path configPath() {
        return tempDir.resolve("machinebridge.yaml");
    }

    /**
     * Runs the command line and captures its output.
     *
     * @param args command-line arguments
     * @return exit code
     */
    protected int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = MachineBridgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }
}

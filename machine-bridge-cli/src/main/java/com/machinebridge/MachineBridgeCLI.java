package com.machinebridge;

import com.machinebridge.cli.ExtractCommand;
import com.machinebridge.cli.MachinesCommand;
import com.machinebridge.cli.PatchCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for MachineBridge.
 *
 * <p>MachineBridge reads state machine definitions written as {@code createMachine({...})}
 * literals in JavaScript and TypeScript files, prints them as digraph JSON, and writes
 * structural patches back into the source with minimal text edits.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code machines} - List the machine factory calls of a file</li>
 *   <li>{@code extract} - Print the digraphs of a file's machines</li>
 *   <li>{@code patch} - Apply digraph patches to a machine's source</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # List machines
 * machine-bridge machines src/machine.ts
 *
 * # Extract the first machine as indented JSON
 * machine-bridge extract src/machine.ts --index 0 --pretty
 *
 * # Apply patches and rewrite the file
 * machine-bridge patch src/machine.ts --index 0 --patches patches.json --write
 * }</pre>
 */
@Command(
    name = "machine-bridge",
    mixinStandardHelpOptions = true,
    version = "MachineBridge 1.0.0-SNAPSHOT",
    description = "Extracts state machine definitions from source code and patches them back",
    subcommands = {
        MachinesCommand.class,
        ExtractCommand.class,
        PatchCommand.class
    }
)
public class MachineBridgeCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(MachineBridgeCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        System.out.println("MachineBridge - State machine extraction and source patching");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'machine-bridge --help' to see available commands");
        System.out.println("Use 'machine-bridge <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        MachineBridgeCLI cli = new MachineBridgeCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}

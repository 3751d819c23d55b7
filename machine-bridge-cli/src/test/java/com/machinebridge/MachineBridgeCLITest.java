package com.machinebridge;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MachineBridgeCLI}.
 */
class MachineBridgeCLITest {

    @Test
    void help_listsSubcommands() {
        StringWriter out = new StringWriter();
        CommandLine commandLine = MachineBridgeCLI.commandLine();
        commandLine.setOut(new PrintWriter(out));

        int exitCode = commandLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("machines", "extract", "patch");
    }

    @Test
    void globalOptions_areParsed() {
        MachineBridgeCLI cli = new MachineBridgeCLI();

        new CommandLine(cli).parseArgs("-v");

        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void unknownSubcommand_isUsageError() {
        CommandLine commandLine = MachineBridgeCLI.commandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("frobnicate")).isEqualTo(2);
    }
}

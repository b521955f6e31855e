package org.chatvault.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.PrintWriter;
import java.io.StringWriter;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import picocli.CommandLine;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void registersSubcommands() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();

        assertThat(cmdLine.getCommandName()).isEqualTo("chatvault");
        assertThat(cmdLine.getSubcommands()).containsKeys("record", "replay", "help");
        assertThat(cmdLine.getSubcommands().get("record").getSubcommands()).containsKeys("stream", "state");
    }

    @Test
    void helpListsCommandsAndConfigOption() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("--help");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("record", "replay", "--config");
    }

    @Test
    void replayRequiresALog() {
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("replay");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("LOG");
    }
}

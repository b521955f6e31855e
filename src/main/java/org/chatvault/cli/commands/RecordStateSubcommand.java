package org.chatvault.cli.commands;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import org.chatvault.archive.chunk.Player;
import org.chatvault.archive.chunk.state.State;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

@Command(
    name = "state",
    mixinStandardHelpOptions = true,
    description = "Print the state (captured messages, threads and files) of a chunk log as JSON"
)
public class RecordStateSubcommand implements Callable<Integer> {

    @Parameters(index = "0", paramLabel = "LOG", description = "Chunk log to inspect")
    private Path logFile;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        try (Player player = Player.open(logFile)) {
            final State state = player.state();
            spec.commandLine().getOut().println(state.toJson());
            spec.commandLine().getOut().flush();
            return 0;
        } catch (IOException e) {
            spec.commandLine().getErr().println("Error: failed to read " + logFile + ": " + e.getMessage());
            return 1;
        }
    }
}

package org.chatvault.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.chatvault.cli.CommandLineInterface;
import org.chatvault.replay.ReplayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValueFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Serves a chunk log through the replay endpoints until the process is interrupted.
 */
@Command(
    name = "replay",
    mixinStandardHelpOptions = true,
    description = "Serve a chunk log over HTTP in the shape of the workspace Web API"
)
public class ReplayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReplayCommand.class);

    @Parameters(index = "0", paramLabel = "LOG", description = "Chunk log to serve")
    private Path logFile;

    @Option(names = {"-p", "--port"}, description = "Listen port (default: chatvault.replay.port)")
    private Integer port;

    @Option(names = {"--host"}, description = "Bind address (default: chatvault.replay.host)")
    private String host;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter err = spec.commandLine().getErr();

        Config options;
        try {
            options = parent.getConfig().getConfig("chatvault.replay");
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        if (port != null) {
            options = options.withValue("port", ConfigValueFactory.fromAnyRef(port));
        }
        if (host != null) {
            options = options.withValue("host", ConfigValueFactory.fromAnyRef(host));
        }

        final CountDownLatch stopped = new CountDownLatch(1);
        try (ReplayServer server = ReplayServer.open(logFile, options)) {
            server.start();
            spec.commandLine().getOut().println("Replaying " + logFile + " on port " + server.port());
            spec.commandLine().getOut().flush();
            Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "replay-shutdown"));
            stopped.await();
            return 0;
        } catch (IOException e) {
            log.debug("replay failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        }
    }
}

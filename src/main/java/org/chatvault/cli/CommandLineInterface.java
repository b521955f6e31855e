package org.chatvault.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.chatvault.cli.commands.RecordCommand;
import org.chatvault.cli.commands.ReplayCommand;
import org.chatvault.cli.config.ConfigLoader;
import org.chatvault.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "chatvault",
    mixinStandardHelpOptions = true,
    version = "chatvault 1.0",
    description = "Record workspace conversations to a chunk log and replay them over HTTP",
    subcommands = {
        RecordCommand.class,
        ReplayCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/chatvault.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // no subcommand
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line with the same setup as {@link #main(String[])}. Tests use this.
     *
     * @return a configured CommandLine
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("chatvault");
        return commandLine;
    }

    private void initialize() {
        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        this.config = ConfigLoader.resolve(this.configFile, (level, message) -> {
            if (level == ConfigLoader.MessageLevel.WARN) {
                logger.warn(message);
            } else {
                logger.info(message);
            }
        });

        if (config.hasPath("logging.format")) {
            final String format = config.getString("logging.format");
            System.setProperty("chatvault.logging.format", "PLAIN".equalsIgnoreCase(format) ? "CONSOLE_PLAIN" : "CONSOLE");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext)) {
            return;
        }
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        final URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }

    /**
     * Returns the configuration, loading it and applying the logging settings on first use.
     *
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named configuration file does not exist
     * @throws ConfigException          if the configuration cannot be parsed
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}

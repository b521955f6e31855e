package org.chatvault.cli.commands;

import java.util.concurrent.Callable;

import org.chatvault.cli.CommandLineInterface;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(
    name = "record",
    mixinStandardHelpOptions = true,
    description = "Record conversations into a chunk log, or inspect what a log contains",
    subcommands = {
        RecordStreamSubcommand.class,
        RecordStateSubcommand.class,
        CommandLine.HelpCommand.class
    }
)
public class RecordCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public CommandLineInterface getParent() {
        return parent;
    }
}

package org.sandpile.cli;

import org.sandpile.cli.commands.RunCommand;
import org.sandpile.cli.commands.VideoCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.util.concurrent.Callable;

@Command(
    name = "sandpile",
    mixinStandardHelpOptions = true,
    version = "Sandpile 1.0",
    description = "Sandpile - 2D Abelian sandpile simulator",
    subcommands = {
        RunCommand.class,
        VideoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    /**
     * Creates the command line with all sub-commands registered.
     *
     * @return The configured command line.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("sandpile");
        return commandLine;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }
}

package com.frameception.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Frameception.
 */
@Command(
        name = "frameception",
        mixinStandardHelpOptions = true,
        version = "Frameception dashboard 0.1.0",
        description = "Watch and drive Frameception projects from the terminal",
        subcommands = {
                WatchCommand.class,
                StatusCommand.class,
                LogsCommand.class,
                ProjectsCommand.class,
                NewProjectCommand.class,
                UpdateCommand.class,
                DeployCommand.class,
                AutofixCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FrameceptionCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

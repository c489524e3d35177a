package com.fauxcloud.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command.
 */
@Command(
        name = "faux-cloud",
        mixinStandardHelpOptions = true,
        version = "Faux Cloud 0.1.0",
        description = "Ephemeral multi-container product instances with automatic expiry",
        subcommands = {
                CreateCommand.class,
                ListCommand.class,
                ShowCommand.class,
                StartCommand.class,
                StopCommand.class,
                DestroyCommand.class,
                LogsCommand.class,
                ExtendCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class FauxCloudCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

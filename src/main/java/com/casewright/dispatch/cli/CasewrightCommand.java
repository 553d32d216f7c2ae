package com.casewright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Casewright.
 */
@Command(
        name = "casewright",
        mixinStandardHelpOptions = true,
        version = "Casewright 0.1.0",
        description = "Turns requirement documents into reviewed manual test cases with a local LLM",
        subcommands = {
                ServeCommand.class,
                ExtractCommand.class,
                GenerateCommand.class,
                StatusCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class CasewrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

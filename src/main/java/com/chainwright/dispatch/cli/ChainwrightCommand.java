package com.chainwright.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for Chainwright.
 * Routes to subcommands: run, servers.
 */
@Command(
        name = "chainwright",
        mixinStandardHelpOptions = true,
        version = "Chainwright 0.1.0",
        description = "Prompt-chain orchestration engine: idea -> PRD -> TRD -> features -> user stories",
        subcommands = {
                RunCommand.class,
                ServersCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class ChainwrightCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        new CommandLine(this).usage(System.out);
    }
}

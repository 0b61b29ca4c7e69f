package com.agentrelay.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for AgentRelay.
 * Routes to subcommands: prompt, health, serve.
 */
@Command(
        name = "agentrelay",
        mixinStandardHelpOptions = true,
        version = "AgentRelay 0.1.0",
        description = "Supervisor that dispatches prompts to worker agents with retries",
        subcommands = {
                PromptCommand.class,
                HealthCommand.class,
                ServeCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class AgentRelayCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}

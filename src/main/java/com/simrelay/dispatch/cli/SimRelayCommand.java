package com.simrelay.dispatch.cli;

import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Top-level CLI command for SimRelay.
 * Routes to subcommands: serve, agent, sign, health.
 */
@Command(
        name = "simrelay",
        mixinStandardHelpOptions = true,
        version = "SimRelay 0.1.0",
        description = "Telemetry relay and command dispatch for a simulated control system",
        subcommands = {
                ServeCommand.class,
                AgentCommand.class,
                SignCommand.class,
                HealthCommand.class,
                CommandLine.HelpCommand.class
        }
)
@Component
public class SimRelayCommand implements Runnable {

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        // When no subcommand is given, show usage help
        new CommandLine(this).usage(System.out);
    }
}

package com.simrelay.dispatch.cli;

import com.simrelay.agent.AgentProperties;
import com.simrelay.agent.RelayAgent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: simrelay agent
 * <p>
 * Runs the polling loop that mirrors simulator variables to the relay server and
 * executes claimed commands against the simulator.
 */
@Command(name = "agent", mixinStandardHelpOptions = true,
        description = "Poll the simulator, upload signed snapshots and execute queued commands")
@Component
public class AgentCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AgentCommand.class);

    @Option(names = "--once", description = "Run a single cycle and exit")
    private boolean once;

    private final RelayAgent relayAgent;
    private final AgentProperties properties;

    public AgentCommand(RelayAgent relayAgent, AgentProperties properties) {
        this.relayAgent = relayAgent;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Simulator: " + properties.getGameUrl());
        ConsoleOutput.info("Relay:     " + properties.getServerUrl());

        if (once) {
            return runCycle() ? 0 : 1;
        }

        ConsoleOutput.info("Polling every " + properties.getPollInterval().toSeconds() + "s. Press Ctrl+C to stop.");
        while (!Thread.currentThread().isInterrupted()) {
            runCycle();
            try {
                Thread.sleep(properties.getPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return 0;
    }

    /** An unexpected error ends the cycle, not the loop. */
    private boolean runCycle() {
        try {
            return relayAgent.runCycle();
        } catch (RuntimeException e) {
            log.error("Agent cycle failed", e);
            return false;
        }
    }
}

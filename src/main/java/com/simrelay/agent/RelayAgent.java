package com.simrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.logging.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * One polling cycle: mirror the simulator's variables to the relay, then claim and
 * execute pending commands. Failures are logged and retried on the next cycle.
 */
public class RelayAgent {

    private static final Logger log = LoggerFactory.getLogger(RelayAgent.class);

    private final SimulatorClient simulator;
    private final RelayClient relay;
    private final JsonStringDecoder decoder;
    private final TaskExecutor executor;
    private final String clientId;
    private final int claimLimit;

    public RelayAgent(SimulatorClient simulator, RelayClient relay, JsonStringDecoder decoder,
                      TaskExecutor executor, String clientId, int claimLimit) {
        this.simulator = simulator;
        this.relay = relay;
        this.decoder = decoder;
        this.executor = executor;
        this.clientId = clientId;
        this.claimLimit = claimLimit;
    }

    /**
     * @return true when the state sync succeeded
     */
    public boolean runCycle() {
        boolean synced = syncState();
        processCommands();
        return synced;
    }

    boolean syncState() {
        try {
            ObjectNode values = simulator.fetchValues();
            JsonNode decoded = decoder.decode(values);
            relay.postSnapshot(decoded);
            log.info("State sync OK ({} variables)", decoded.size());
            return true;
        } catch (AgentException e) {
            log.warn("State sync failed: {}", e.getMessage());
            return false;
        }
    }

    int processCommands() {
        List<ClaimedCommand> commands;
        try {
            commands = relay.claimCommands(claimLimit, clientId);
        } catch (AgentException e) {
            log.warn("Command poll failed: {}", e.getMessage());
            return 0;
        }
        for (ClaimedCommand command : commands) {
            MdcContext.setCommand(command.id());
            MdcContext.setClient(clientId);
            try {
                if (command.tasks().isEmpty()) {
                    log.warn("Command {} arrived without tasks", command.id());
                    relay.reportResult(command.id(), "failed", "Command has no tasks", null);
                    continue;
                }
                log.info("Executing '{}' ({} task(s))", command.purpose(), command.tasks().size());
                TaskExecutor.Outcome outcome = executor.execute(command.tasks());
                if (outcome.succeeded()) {
                    relay.reportResult(command.id(), "completed",
                            "Executed " + command.tasks().size() + " task(s)", outcome.outputs());
                } else {
                    relay.reportResult(command.id(), "failed", outcome.failure(), outcome.outputs());
                }
            } catch (AgentException e) {
                log.error("Could not report result for command {}: {}", command.id(), e.getMessage());
            } finally {
                MdcContext.clear();
            }
        }
        return commands.size();
    }
}

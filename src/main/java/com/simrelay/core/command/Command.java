package com.simrelay.core.command;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.List;

/**
 * A queued unit of operator intent. Transitions produce new instances; the
 * {@link CommandQueue} swaps them under its lock.
 *
 * @param sequence creation order; tie-break for equal priority and the eviction key. Internal only.
 */
public record Command(
    String id,
    String purpose,
    List<Task> tasks,
    int priority,
    JsonNode metadata,
    JsonNode guidance,
    CommandStatus status,
    Instant createdAt,
    Instant claimedAt,
    String claimedBy,
    CommandResult result,
    long sequence
) {

    public Command {
        tasks = List.copyOf(tasks);
    }

    Command claim(String claimant, Instant at) {
        return new Command(id, purpose, tasks, priority, metadata, guidance,
                CommandStatus.IN_PROGRESS, createdAt, at, claimant, result, sequence);
    }

    Command resolve(CommandStatus terminal, CommandResult outcome) {
        return new Command(id, purpose, tasks, priority, metadata, guidance,
                terminal, createdAt, claimedAt, claimedBy, outcome, sequence);
    }
}

package com.simrelay.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.simrelay.core.command.Command;
import com.simrelay.core.command.CommandResult;
import com.simrelay.core.command.CommandStatus;
import com.simrelay.core.command.Task;

import java.time.Instant;
import java.util.List;

/**
 * Public JSON view of a {@link Command}; internal fields such as the sequence number are omitted.
 */
public record CommandView(
    String id,
    String purpose,
    List<Task> tasks,
    int priority,
    JsonNode metadata,
    JsonNode guidance,
    CommandStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("claimed_at") Instant claimedAt,
    @JsonProperty("claimed_by") String claimedBy,
    CommandResult result
) {

    public static CommandView from(Command command) {
        return new CommandView(command.id(), command.purpose(), command.tasks(), command.priority(),
                command.metadata(), command.guidance(), command.status(), command.createdAt(),
                command.claimedAt(), command.claimedBy(), command.result());
    }
}

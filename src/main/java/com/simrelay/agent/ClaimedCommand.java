package com.simrelay.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.simrelay.core.command.Task;

import java.util.List;

/**
 * The subset of a command the agent needs to execute it. A missing {@code tasks}
 * field reads as an empty list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClaimedCommand(String id, String purpose, List<Task> tasks) {

    public ClaimedCommand {
        tasks = tasks == null ? List.of() : tasks;
    }
}

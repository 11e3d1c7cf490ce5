package com.simrelay.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.simrelay.core.command.TaskDraft;

import java.util.List;

/**
 * Inbound JSON body for POST /api/commands.
 *
 * @param purpose  short operator summary, 3-200 characters after trimming
 * @param tasks    ordered steps; at least one
 * @param metadata free-form context; nullable
 * @param priority -10..10, higher first; nullable, defaults to 0
 * @param guidance free-form execution hints; nullable
 */
public record CommandRequest(
    String purpose,
    List<TaskDraft> tasks,
    JsonNode metadata,
    Integer priority,
    JsonNode guidance
) {}

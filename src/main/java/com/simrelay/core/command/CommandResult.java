package com.simrelay.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Outcome reported by the agent that executed a command. Set once.
 */
public record CommandResult(
    String detail,
    JsonNode outputs,
    @JsonProperty("reported_at") Instant reportedAt
) {}

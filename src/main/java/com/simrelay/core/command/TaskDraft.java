package com.simrelay.core.command;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Unvalidated task as submitted by an operator. {@link CommandValidator} turns it into a {@link Task}.
 */
public record TaskDraft(
    String operation,
    String variable,
    JsonNode value,
    @JsonProperty("reset_value") JsonNode resetValue,
    @JsonProperty("hold_seconds") Double holdSeconds,
    String comment
) {}

package com.simrelay.core.command;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One validated control step. Immutable once attached to a {@link Command}.
 *
 * @param operation   set or pulse
 * @param variable    simulator variable to write
 * @param value       value written first
 * @param resetValue  value written after the hold; pulse only
 * @param holdSeconds hold before reset; always 0 for set
 * @param comment     optional operator note
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
    TaskOperation operation,
    String variable,
    JsonNode value,
    @JsonProperty("reset_value") JsonNode resetValue,
    @JsonProperty("hold_seconds") double holdSeconds,
    String comment
) {}

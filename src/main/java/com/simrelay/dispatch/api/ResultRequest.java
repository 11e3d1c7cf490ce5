package com.simrelay.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound JSON body for POST /api/commands/{id}/result.
 *
 * @param status  "completed" or "failed"
 * @param detail  human-readable outcome; nullable
 * @param outputs agent-defined output payload; nullable
 */
public record ResultRequest(String status, String detail, JsonNode outputs) {}

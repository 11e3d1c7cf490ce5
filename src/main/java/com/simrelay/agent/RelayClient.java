package com.simrelay.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.security.SignatureVerifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * HTTP client for the relay server: signed snapshot uploads and the command API.
 */
public class RelayClient {

    private static final Logger log = LoggerFactory.getLogger(RelayClient.class);

    private final String serverUrl;
    private final String apiKey;
    private final String commandToken;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RelayClient(String serverUrl, String apiKey, String commandToken, Duration timeout,
                       HttpClient httpClient, ObjectMapper objectMapper, Clock clock) {
        this.serverUrl = SimulatorClient.stripTrailingSlash(serverUrl);
        this.apiKey = apiKey;
        this.commandToken = commandToken;
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Signs and uploads {@code data} as the new snapshot.
     *
     * @return the exact body bytes that were sent
     */
    public byte[] postSnapshot(JsonNode data) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("timestamp", Instant.now(clock).toString());
        payload.set("data", data);

        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to serialize snapshot", e);
        }

        var request = HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + "/api/state"))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("X-Signature", SignatureVerifier.sign(apiKey, body))
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        send(request, "snapshot upload");
        return body;
    }

    public List<ClaimedCommand> claimCommands(int limit, String clientId) {
        var request = commandRequest("/api/commands/next?limit=" + limit + "&client_id=" + encode(clientId))
                .GET()
                .build();
        JsonNode response = readJson(send(request, "command poll"));
        var commands = new ArrayList<ClaimedCommand>();
        for (JsonNode node : response.path("commands")) {
            try {
                commands.add(objectMapper.treeToValue(node, ClaimedCommand.class));
            } catch (JsonProcessingException e) {
                throw new AgentException("Unreadable command in poll response", e);
            }
        }
        return commands;
    }

    public void reportResult(String commandId, String status, String detail, JsonNode outputs) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("status", status);
        body.put("detail", detail);
        body.set("outputs", outputs);

        var request = commandRequest("/api/commands/" + encode(commandId) + "/result")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
                .build();
        send(request, "result report for " + commandId);
        log.info("Reported {} for command {}", status, commandId);
    }

    private HttpRequest.Builder commandRequest(String path) {
        return HttpRequest.newBuilder()
                .uri(URI.create(serverUrl + path))
                .timeout(timeout)
                .header("X-Command-Token", commandToken == null ? "" : commandToken);
    }

    private String send(HttpRequest request, String action) {
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new AgentException("Relay %s failed (HTTP %d): %s"
                        .formatted(action, response.statusCode(), response.body()));
            }
            return response.body();
        } catch (IOException e) {
            throw new AgentException("Relay " + action + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted during relay " + action, e);
        }
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new AgentException("Relay returned invalid JSON", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}

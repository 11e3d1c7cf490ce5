package com.simrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP client for the simulator's built-in webserver. Reads use the batch variable
 * dump, writes use the single-variable form of the same query interface.
 */
public class SimulatorClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatorClient.class);

    static final String BATCH_GET = "WEBSERVER_BATCH_GET";

    private final String gameUrl;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public SimulatorClient(String gameUrl, Duration timeout, HttpClient httpClient, ObjectMapper objectMapper) {
        this.gameUrl = stripTrailingSlash(gameUrl);
        this.timeout = timeout;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Fetches every variable. The response's {@code values} member must be an object.
     */
    public ObjectNode fetchValues() {
        String body = send(query(BATCH_GET, "*"), "batch read");
        JsonNode values;
        try {
            values = objectMapper.readTree(body).path("values");
        } catch (IOException e) {
            throw new AgentException("Simulator returned invalid JSON", e);
        }
        if (!values.isObject()) {
            throw new AgentException("Unexpected payload structure from simulator webserver");
        }
        return (ObjectNode) values;
    }

    /**
     * Writes one variable. Scalars are sent as their text form, containers as compact JSON.
     */
    public void setVariable(String variable, JsonNode value) {
        String text = value.isValueNode() ? value.asText() : value.toString();
        send(query(variable, text), "write of " + variable);
        log.debug("Set {} = {}", variable, text);
    }

    private URI query(String variable, String value) {
        return URI.create(gameUrl + "/?Variable=" + encode(variable) + "&value=" + encode(value));
    }

    private String send(URI uri, String action) {
        var request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            var response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new AgentException("Simulator %s failed (HTTP %d)".formatted(action, response.statusCode()));
            }
            return response.body() == null ? "" : response.body();
        } catch (IOException e) {
            throw new AgentException("Simulator " + action + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentException("Interrupted during simulator " + action, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}

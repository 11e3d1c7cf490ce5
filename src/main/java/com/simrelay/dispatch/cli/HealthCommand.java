package com.simrelay.dispatch.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simrelay.agent.AgentProperties;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * CLI command: simrelay health
 * <p>
 * Queries a running server's health endpoint and displays each component with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check relay server health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = "--url", description = "Server base URL (default: simrelay.agent.server-url)")
    private String url;

    private final AgentProperties agentProperties;
    private final ObjectMapper objectMapper;

    public HealthCommand(AgentProperties agentProperties, ObjectMapper objectMapper) {
        this.agentProperties = agentProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        String base = url != null ? url : agentProperties.getServerUrl();

        JsonNode health;
        try {
            var client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
            var request = HttpRequest.newBuilder()
                    .uri(URI.create(base + "/api/health"))
                    .timeout(Duration.ofSeconds(10))
                    .GET()
                    .build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofString());
            health = objectMapper.readTree(response.body());
        } catch (IOException e) {
            ConsoleOutput.error("Cannot reach " + base + ": " + e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }

        health.path("components").fields().forEachRemaining(entry -> {
            String status = entry.getValue().path("status").asText();
            String label = entry.getKey() + ": " + entry.getValue().path("detail").asText();
            switch (status) {
                case "UP" -> ConsoleOutput.success(label);
                case "DEGRADED" -> ConsoleOutput.degraded(label);
                default -> ConsoleOutput.error(label);
            }
        });

        System.out.println("──────────────────────────────────");
        String overall = health.path("status").asText("DOWN");
        if ("DOWN".equals(overall)) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: " + overall);
        return 0;
    }
}

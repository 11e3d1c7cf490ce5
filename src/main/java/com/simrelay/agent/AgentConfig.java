package com.simrelay.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.simrelay.core.security.RelayProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Wires the polling agent from {@link AgentProperties} and the shared secrets.
 */
@Configuration
public class AgentConfig {

    @Bean
    public RelayAgent relayAgent(AgentProperties agent, RelayProperties secrets, ObjectMapper objectMapper) {
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(agent.getRequestTimeout())
                .build();
        var simulator = new SimulatorClient(agent.getGameUrl(), agent.getRequestTimeout(), httpClient, objectMapper);
        var relay = new RelayClient(agent.getServerUrl(), secrets.getApiKey(), secrets.getCommandToken(),
                agent.getRequestTimeout(), httpClient, objectMapper, Clock.systemUTC());
        var executor = new TaskExecutor(simulator, objectMapper, duration -> Thread.sleep(duration.toMillis()));
        return new RelayAgent(simulator, relay, new JsonStringDecoder(objectMapper), executor,
                agent.getClientId(), agent.getClaimLimit());
    }
}

package com.simrelay.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Settings for the polling agent. The API key and command token are shared with the
 * server under {@code simrelay.api-key} and {@code simrelay.command-token}.
 */
@Component
@ConfigurationProperties(prefix = "simrelay.agent")
public class AgentProperties {

    private String serverUrl = "http://localhost:8080";
    private String gameUrl = "http://localhost:8081";
    private Duration pollInterval = Duration.ofSeconds(5);
    private String clientId = "simrelay-agent";
    private int claimLimit = 5;
    private Duration requestTimeout = Duration.ofSeconds(10);

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getGameUrl() {
        return gameUrl;
    }

    public void setGameUrl(String gameUrl) {
        this.gameUrl = gameUrl;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public int getClaimLimit() {
        return claimLimit;
    }

    public void setClaimLimit(int claimLimit) {
        this.claimLimit = claimLimit;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }
}

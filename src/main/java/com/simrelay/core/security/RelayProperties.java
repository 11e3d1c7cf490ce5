package com.simrelay.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Shared secrets for the relay endpoints.
 */
@Component
@ConfigurationProperties(prefix = "simrelay")
public class RelayProperties {

    public static final String DEFAULT_API_KEY = "changeme";

    /** HMAC key used by the polling agent to sign snapshot uploads. */
    private String apiKey = DEFAULT_API_KEY;

    /** Static token required on every command API call. Empty disables the command API. */
    private String commandToken = "";

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getCommandToken() {
        return commandToken;
    }

    public void setCommandToken(String commandToken) {
        this.commandToken = commandToken;
    }

    public boolean isDefaultApiKey() {
        return DEFAULT_API_KEY.equals(apiKey);
    }

    public boolean hasCommandToken() {
        return commandToken != null && !commandToken.isEmpty();
    }
}

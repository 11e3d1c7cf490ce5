package com.simrelay.agent;

/**
 * An HTTP exchange made by the agent failed. The agent logs it and retries on the next cycle.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.simrelay.core.command;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "simrelay.commands")
public class CommandProperties {

    /** Retained commands before terminal entries are evicted. */
    private int historyLimit = 200;

    /** Upper bound for the claim batch size. */
    private int maxClaimBatch = 50;

    /** Age after which an in-progress claim is reported as stale. */
    private Duration staleClaimAfter = Duration.ofMinutes(10);

    public int getHistoryLimit() {
        return historyLimit;
    }

    public void setHistoryLimit(int historyLimit) {
        this.historyLimit = Math.max(1, historyLimit);
    }

    public int getMaxClaimBatch() {
        return maxClaimBatch;
    }

    public void setMaxClaimBatch(int maxClaimBatch) {
        this.maxClaimBatch = maxClaimBatch;
    }

    public Duration getStaleClaimAfter() {
        return staleClaimAfter;
    }

    public void setStaleClaimAfter(Duration staleClaimAfter) {
        this.staleClaimAfter = staleClaimAfter;
    }
}

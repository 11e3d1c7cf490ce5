package com.simrelay.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * One component's contribution to {@code GET /api/health}.
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {
    /** Ordered by severity; the overall status is the most severe component status. */
    public enum Status { UP, DEGRADED, DOWN }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DOWN, detail, metadata);
    }

    /** UP for an empty collection. */
    public static Status overall(Collection<HealthStatus> components) {
        Status worst = Status.UP;
        for (HealthStatus component : components) {
            if (component.status().compareTo(worst) > 0) {
                worst = component.status();
            }
        }
        return worst;
    }
}

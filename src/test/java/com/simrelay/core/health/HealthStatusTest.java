package com.simrelay.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    @DisplayName("overall is the most severe component status")
    void overallTakesWorst() {
        var up = HealthStatus.up("schema", "ok", Map.of());
        var degraded = HealthStatus.degraded("snapshot", "none yet", Map.of());
        var down = HealthStatus.down("schema", "empty", Map.of());

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of(up)));
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.overall(List.of(up, degraded)));
        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(List.of(down, degraded, up)));
    }

    @Test
    @DisplayName("no components -> UP")
    void overallOfNothing() {
        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(List.of()));
    }
}

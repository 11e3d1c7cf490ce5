package com.simrelay.core.health;

import com.simrelay.core.command.CommandQueue;
import com.simrelay.core.command.CommandProperties;
import com.simrelay.core.schema.SchemaIndex;
import com.simrelay.core.state.StateStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private final SchemaIndex schemaIndex;
    private final StateStore stateStore;
    private final CommandQueue commandQueue;
    private final CommandProperties commandProperties;

    public HealthCheckService(SchemaIndex schemaIndex, StateStore stateStore,
                              CommandQueue commandQueue, CommandProperties commandProperties) {
        this.schemaIndex = schemaIndex;
        this.stateStore = stateStore;
        this.commandQueue = commandQueue;
        this.commandProperties = commandProperties;
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkSchema(), checkSnapshot(), checkCommands());
    }

    /** DOWN when the loaded schema declares nothing: group reads would all 404 and no value translates. */
    private HealthStatus checkSchema() {
        var metadata = Map.of("groups", String.valueOf(schemaIndex.groupCount()));
        if (schemaIndex.isEmpty()) {
            return HealthStatus.down("schema", "Schema declares no groups or variables", metadata);
        }
        return HealthStatus.up("schema", "Schema loaded with " + schemaIndex.groupCount() + " groups", metadata);
    }

    private HealthStatus checkSnapshot() {
        return stateStore.current()
                .map(s -> HealthStatus.up("snapshot",
                        "Snapshot received at " + s.receivedAt(),
                        Map.of("keys", String.valueOf(s.data().size()),
                                "last_updated", String.valueOf(s.lastUpdated()))))
                .orElseGet(() -> HealthStatus.degraded("snapshot", "No snapshot received yet", Map.of()));
    }

    private HealthStatus checkCommands() {
        long stale = commandQueue.countStaleClaims();
        var metadata = Map.of(
                "retained", String.valueOf(commandQueue.size()),
                "stale_claims", String.valueOf(stale));
        if (stale > 0) {
            return HealthStatus.degraded("commands",
                    stale + " command(s) in progress longer than " + commandProperties.getStaleClaimAfter(),
                    metadata);
        }
        return HealthStatus.up("commands", "Command queue available", metadata);
    }
}

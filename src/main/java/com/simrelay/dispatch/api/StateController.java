package com.simrelay.dispatch.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.simrelay.core.state.GroupListing;
import com.simrelay.core.state.Snapshot;
import com.simrelay.core.state.StateIngestionService;
import com.simrelay.core.state.StateQueryService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot ingestion and read views.
 */
@RestController
@RequestMapping("/api")
public class StateController {

    public static final String SIGNATURE_HEADER = "X-Signature";

    private final StateIngestionService ingestionService;
    private final StateQueryService queryService;

    public StateController(StateIngestionService ingestionService, StateQueryService queryService) {
        this.ingestionService = ingestionService;
        this.queryService = queryService;
    }

    /**
     * POST /api/state: Replace the snapshot with a signed upload.
     */
    @PostMapping("/state")
    public ResponseEntity<Map<String, Object>> updateState(
            @RequestBody(required = false) byte[] body,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        List<String> keys = ingestionService.ingest(body != null ? body : new byte[0], signature);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "updated");
        response.put("updated_keys", keys);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/state: Full snapshot, optionally flattened to dotted/indexed paths.
     */
    @GetMapping("/state")
    public ResponseEntity<Map<String, Object>> getState(@RequestParam(defaultValue = "false") boolean flat) {
        Snapshot snapshot = queryService.require();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("last_updated", snapshot.lastUpdated());
        response.put("data", queryService.fullData(snapshot, flat));
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/groups: Declared schema groups and groups inferred from the snapshot.
     */
    @GetMapping("/groups")
    public ResponseEntity<GroupListing> listGroups() {
        return ResponseEntity.ok(queryService.listGroups(queryService.require()));
    }

    /**
     * GET /api/state/{group}: Group, single variable or prefix view.
     */
    @GetMapping("/state/{group}")
    public ResponseEntity<JsonNode> getGroup(@PathVariable String group) {
        return ResponseEntity.ok(queryService.byGroup(queryService.require(), group));
    }

    /**
     * GET /api/state/keys/{path}: Slash-delimited nested lookup.
     */
    @GetMapping("/state/keys/{*path}")
    public ResponseEntity<JsonNode> getByPath(@PathVariable String path) {
        Snapshot snapshot = queryService.require();
        List<String> segments = Arrays.stream(path.split("/"))
                .filter(s -> !s.isEmpty())
                .toList();
        return ResponseEntity.ok(queryService.byPath(snapshot, segments));
    }
}

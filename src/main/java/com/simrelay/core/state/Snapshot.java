package com.simrelay.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.schema.SchemaIndex;

import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single current telemetry tree. Instances are never mutated after construction;
 * the {@link StateStore} swaps whole snapshots.
 *
 * @param data        top-level variable mapping (owned copy, treat as read-only)
 * @param lastUpdated timestamp supplied by the sender, may be {@code null}
 * @param receivedAt  server time of ingestion
 */
public record Snapshot(ObjectNode data, String lastUpdated, Instant receivedAt, Map<String, String> keyIndex) {

    public Snapshot {
        keyIndex = Collections.unmodifiableMap(keyIndex);
    }

    public static Snapshot of(ObjectNode data, String lastUpdated, Instant receivedAt) {
        ObjectNode copy = data.deepCopy();
        var index = new HashMap<String, String>();
        copy.fieldNames().forEachRemaining(name -> index.putIfAbsent(SchemaIndex.normalize(name), name));
        return new Snapshot(copy, lastUpdated, receivedAt, index);
    }

    /** Resolves a top-level key ignoring case and treating spaces as underscores. */
    public Optional<String> resolveKey(String name) {
        if (data.has(name)) {
            return Optional.of(name);
        }
        return Optional.ofNullable(keyIndex.get(SchemaIndex.normalize(name)));
    }

    public JsonNode get(String actualKey) {
        return data.get(actualKey);
    }
}

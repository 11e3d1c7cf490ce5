package com.simrelay.core.state;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flattens a telemetry tree into path/value pairs. Object members append {@code .key},
 * array elements append {@code [index]}. A container with no leaves is kept as-is
 * under its own path.
 */
public final class SnapshotFlattener {

    private SnapshotFlattener() {}

    public static Map<String, JsonNode> flatten(JsonNode root) {
        var out = new LinkedHashMap<String, JsonNode>();
        if (root.isObject()) {
            root.fields().forEachRemaining(e -> walk(e.getKey(), e.getValue(), out));
        } else if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                walk("[" + i + "]", root.get(i), out);
            }
        }
        return out;
    }

    private static void walk(String path, JsonNode node, Map<String, JsonNode> out) {
        if (node.isContainerNode()) {
            if (node.isEmpty()) {
                out.put(path, node);
                return;
            }
            if (node.isObject()) {
                node.fields().forEachRemaining(e -> walk(path + "." + e.getKey(), e.getValue(), out));
            } else {
                for (int i = 0; i < node.size(); i++) {
                    walk(path + "[" + i + "]", node.get(i), out);
                }
            }
            return;
        }
        out.put(path, node);
    }
}

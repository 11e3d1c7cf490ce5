package com.simrelay.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.error.BadRequestException;
import com.simrelay.core.error.NotFoundException;
import com.simrelay.core.schema.SchemaIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Schema-aware read views over the current {@link Snapshot}.
 * <p>
 * Every view fails with {@link NotFoundException} while no snapshot has been received.
 */
@Service
public class StateQueryService {

    private static final Logger log = LoggerFactory.getLogger(StateQueryService.class);

    private static final Set<String> WHOLE_SNAPSHOT_ALIASES = Set.of("ALL", "FULL");

    private final StateStore stateStore;
    private final SchemaIndex schemaIndex;
    private final ObjectMapper objectMapper;

    public StateQueryService(StateStore stateStore, SchemaIndex schemaIndex, ObjectMapper objectMapper) {
        this.stateStore = stateStore;
        this.schemaIndex = schemaIndex;
        this.objectMapper = objectMapper;
    }

    public Snapshot require() {
        return stateStore.current()
                .orElseThrow(() -> new NotFoundException("No state has been received yet"));
    }

    /**
     * Whole snapshot, optionally flattened to path/value pairs.
     */
    public JsonNode fullData(Snapshot snapshot, boolean flat) {
        if (!flat) {
            return snapshot.data();
        }
        ObjectNode flattened = objectMapper.createObjectNode();
        SnapshotFlattener.flatten(snapshot.data()).forEach((path, value) -> flattened.set(path, value));
        return flattened;
    }

    /**
     * Resolves a group, a single variable, or a key prefix.
     * <ol>
     *   <li>{@code ALL}/{@code FULL} return the raw snapshot.</li>
     *   <li>A top-level key equal to {@code name} whose value is an object returns that sub-tree.</li>
     *   <li>Otherwise the result combines schema members of the group, a scalar top-level key
     *       equal to {@code name}, and every top-level key starting with {@code name_}.</li>
     * </ol>
     * Values are passed through {@link SchemaIndex#translate}.
     */
    public JsonNode byGroup(Snapshot snapshot, String name) {
        String key = SchemaIndex.normalize(name);
        if (WHOLE_SNAPSHOT_ALIASES.contains(key)) {
            return snapshot.data();
        }

        String exactKey = snapshot.resolveKey(name).orElse(null);
        if (exactKey != null && snapshot.get(exactKey).isObject()) {
            return translateMembers(name, snapshot.get(exactKey));
        }

        ObjectNode result = objectMapper.createObjectNode();
        schemaIndex.resolveGroup(name).ifPresent(members -> {
            for (String member : members) {
                snapshot.resolveKey(member).ifPresent(actual ->
                        result.set(actual, schemaIndex.translate(name, actual, snapshot.get(actual))));
            }
        });
        if (exactKey != null) {
            result.set(exactKey, schemaIndex.translate(name, exactKey, snapshot.get(exactKey)));
        }

        String prefix = key + "_";
        Iterator<Map.Entry<String, JsonNode>> fields = snapshot.data().fields();
        while (fields.hasNext()) {
            var entry = fields.next();
            if (!result.has(entry.getKey()) && SchemaIndex.normalize(entry.getKey()).startsWith(prefix)) {
                result.set(entry.getKey(), schemaIndex.translate(name, entry.getKey(), entry.getValue()));
            }
        }

        if (result.isEmpty()) {
            log.debug("No group, variable or prefix match for '{}'", name);
            throw new NotFoundException("No data found for group or variable: " + name);
        }
        return result;
    }

    /**
     * Walks the snapshot one segment at a time. Object keys match case-insensitively;
     * array segments must be integer indexes. A single-segment path is translated
     * through the schema, deeper paths are returned raw.
     */
    public JsonNode byPath(Snapshot snapshot, List<String> segments) {
        if (segments.isEmpty()) {
            throw new BadRequestException("Path must contain at least one segment");
        }
        JsonNode current = snapshot.data();
        String leafKey = null;
        var walked = new ArrayList<String>();

        for (String segment : segments) {
            if (current.isObject()) {
                leafKey = resolveChild(current, segment);
                if (leafKey == null) {
                    throw new NotFoundException("Key '" + segment + "' not found at /" + String.join("/", walked));
                }
                current = current.get(leafKey);
            } else if (current.isArray()) {
                int index;
                try {
                    index = Integer.parseInt(segment);
                } catch (NumberFormatException e) {
                    throw new BadRequestException("Segment '" + segment + "' is not a valid list index");
                }
                if (index < 0 || index >= current.size()) {
                    throw new NotFoundException("Index " + index + " out of range at /" + String.join("/", walked));
                }
                current = current.get(index);
            } else {
                throw new NotFoundException("Cannot descend into scalar value at /" + String.join("/", walked));
            }
            walked.add(segment);
        }

        if (segments.size() == 1 && leafKey != null && !current.isContainerNode()) {
            String group = schemaIndex.groupOf(leafKey).orElse(null);
            return schemaIndex.translate(group, leafKey, current);
        }
        return current;
    }

    /**
     * Declared schema groups plus groups inferred from the snapshot: object-valued
     * top-level keys contribute their own name, other keys the token before their
     * first underscore.
     */
    public GroupListing listGroups(Snapshot snapshot) {
        var inferred = new TreeSet<String>();
        snapshot.data().fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            if (entry.getValue().isObject()) {
                inferred.add(name);
            } else {
                int underscore = name.indexOf('_');
                inferred.add(underscore > 0 ? name.substring(0, underscore) : name);
            }
        });
        return new GroupListing(snapshot.lastUpdated(), schemaIndex.groupNames(), List.copyOf(inferred));
    }

    private ObjectNode translateMembers(String group, JsonNode subtree) {
        ObjectNode out = objectMapper.createObjectNode();
        subtree.fields().forEachRemaining(e -> out.set(e.getKey(),
                e.getValue().isContainerNode() ? e.getValue() : schemaIndex.translate(group, e.getKey(), e.getValue())));
        return out;
    }

    private static String resolveChild(JsonNode object, String segment) {
        if (object.has(segment)) {
            return segment;
        }
        Iterator<String> names = object.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (name.equalsIgnoreCase(segment)) {
                return name;
            }
        }
        return null;
    }
}

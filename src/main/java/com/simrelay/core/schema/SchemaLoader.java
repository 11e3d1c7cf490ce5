package com.simrelay.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Parses the variable schema document.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "groups": {
 *     "COOLANT": {
 *       "variables": {
 *         "COOLANT_TEMP": {},
 *         "COOLANT_VALVE": {"oneOf": [{"const": 0, "description": "Closed"},
 *                                     {"type": "integer", "description": "Partially open"}]}
 *       }
 *     }
 *   },
 *   "variables": {
 *     "COOLANT_PUMP_STATE": {"oneOf": [{"const": 1, "description": "Running"}]}
 *   }
 * }
 * </pre>
 * A group's {@code variables} may also be a plain array of names. Top-level
 * {@code variables} holds rules for variables that belong to no group.
 */
public class SchemaLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaLoader.class);

    private final ObjectMapper objectMapper;

    public SchemaLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SchemaIndex load(Resource resource) {
        if (!resource.exists()) {
            throw new SchemaLoadException("Schema resource not found: " + resource.getDescription());
        }
        try (InputStream in = resource.getInputStream()) {
            SchemaIndex index = parse(objectMapper.readTree(in));
            log.info("Loaded variable schema from {} ({} groups)", resource.getDescription(), index.groupCount());
            return index;
        } catch (IOException e) {
            throw new SchemaLoadException("Failed to read schema " + resource.getDescription(), e);
        }
    }

    public SchemaIndex parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new SchemaLoadException("Schema root must be a JSON object");
        }
        JsonNode groupsNode = root.path("groups");
        if (!groupsNode.isMissingNode() && !groupsNode.isObject()) {
            throw new SchemaLoadException("'groups' must be an object");
        }

        var groups = new ArrayList<SchemaGroup>();
        var groupFields = groupsNode.fields();
        while (groupFields.hasNext()) {
            var entry = groupFields.next();
            groups.add(parseGroup(entry.getKey(), entry.getValue()));
        }

        JsonNode standalone = root.path("variables");
        Map<String, List<EnumRule>> standaloneRules = new LinkedHashMap<>();
        if (!standalone.isMissingNode()) {
            if (!standalone.isObject()) {
                throw new SchemaLoadException("'variables' must be an object");
            }
            var fields = standalone.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                List<EnumRule> rules = parseRules(entry.getKey(), entry.getValue());
                if (!rules.isEmpty()) {
                    standaloneRules.put(entry.getKey(), rules);
                }
            }
        }
        return new SchemaIndex(groups, standaloneRules);
    }

    private SchemaGroup parseGroup(String name, JsonNode node) {
        if (!node.isObject()) {
            throw new SchemaLoadException("Group " + name + " must be an object");
        }
        JsonNode variablesNode = node.path("variables");
        var variables = new LinkedHashSet<String>();
        var rules = new LinkedHashMap<String, List<EnumRule>>();

        if (variablesNode.isArray()) {
            for (JsonNode item : variablesNode) {
                if (!item.isTextual() || item.asText().isBlank()) {
                    throw new SchemaLoadException("Group " + name + " lists a non-string variable name");
                }
                variables.add(item.asText());
            }
        } else if (variablesNode.isObject()) {
            var fields = variablesNode.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                variables.add(entry.getKey());
                List<EnumRule> parsed = parseRules(entry.getKey(), entry.getValue());
                if (!parsed.isEmpty()) {
                    rules.put(SchemaIndex.normalize(entry.getKey()), parsed);
                }
            }
        } else {
            throw new SchemaLoadException("Group " + name + " must declare 'variables' as an object or array");
        }
        return new SchemaGroup(name, variables, rules);
    }

    private List<EnumRule> parseRules(String variable, JsonNode definition) {
        if (!definition.isObject()) {
            throw new SchemaLoadException("Definition of " + variable + " must be an object");
        }
        JsonNode oneOf = definition.path("oneOf");
        if (oneOf.isMissingNode()) {
            return List.of();
        }
        if (!oneOf.isArray()) {
            throw new SchemaLoadException("'oneOf' of " + variable + " must be an array");
        }
        var rules = new ArrayList<EnumRule>();
        for (JsonNode option : oneOf) {
            if (!option.isObject()) {
                throw new SchemaLoadException("'oneOf' entries of " + variable + " must be objects");
            }
            JsonNode description = option.get("description");
            if (description != null && !description.isTextual()) {
                throw new SchemaLoadException("Description in " + variable + " must be a string");
            }
            JsonNode type = option.get("type");
            if (type != null && !type.isTextual()) {
                throw new SchemaLoadException("Type in " + variable + " must be a string");
            }
            rules.add(new EnumRule(
                    option.get("const"),
                    type != null ? type.asText() : null,
                    description != null ? description.asText() : null));
        }
        return rules;
    }
}

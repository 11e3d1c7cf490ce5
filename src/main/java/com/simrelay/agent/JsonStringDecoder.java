package com.simrelay.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Recursively expands string values that themselves contain JSON documents.
 * The simulator reports nested structures as encoded strings; strings that do not
 * parse are kept as they are.
 */
public class JsonStringDecoder {

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public JsonStringDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public JsonNode decode(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isTextual()) {
            JsonNode parsed = tryParse(node.asText());
            return parsed == null ? node : decode(parsed);
        }
        if (node.isObject()) {
            ObjectNode out = objectMapper.createObjectNode();
            node.fields().forEachRemaining(e -> out.set(e.getKey(), decode(e.getValue())));
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = objectMapper.createArrayNode();
            node.forEach(item -> out.add(decode(item)));
            return out;
        }
        return node;
    }

    private JsonNode tryParse(String text) {
        if (text.isBlank()) {
            return null;
        }
        try {
            JsonNode parsed = strictReader.readTree(text);
            return parsed == null || parsed.isMissingNode() ? null : parsed;
        } catch (JsonProcessingException e) {
            return null;
        }
    }
}

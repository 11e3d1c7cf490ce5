package com.simrelay.core.schema;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of a variable's {@code oneOf} translation list.
 *
 * @param constant    exact raw value this rule matches; {@code null} for a type-only rule
 * @param type        declared JSON type (e.g. "integer"); {@code null} when absent
 * @param description display text returned on a match; {@code null} when absent
 */
public record EnumRule(JsonNode constant, String type, String description) {

    public boolean hasConstant() {
        return constant != null;
    }

    /** True for a rule that declares a type but no constant, i.e. the typed fallback. */
    public boolean isTypeFallback() {
        return constant == null && type != null;
    }

    /**
     * Exact-match test. Numbers compare by value so that a schema constant {@code 1}
     * matches a telemetry value of {@code 1.0}.
     */
    public boolean matches(JsonNode raw) {
        if (constant == null || raw == null) {
            return false;
        }
        if (constant.isNumber() && raw.isNumber()) {
            return constant.decimalValue().compareTo(raw.decimalValue()) == 0;
        }
        return constant.equals(raw);
    }
}

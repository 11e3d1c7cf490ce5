package com.simrelay.core.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SchemaIndexTest {

    private SchemaIndex index;

    @BeforeEach
    void setUp() {
        var pumpRules = List.of(
                new EnumRule(IntNode.valueOf(0), null, "Stopped"),
                new EnumRule(IntNode.valueOf(1), null, "Running"),
                new EnumRule(null, "integer", "Cycling"));
        var coolant = new SchemaGroup("Coolant Loop",
                Set.of("COOLANT_TEMP", "COOLANT_PUMP"),
                Map.of("COOLANT_PUMP", pumpRules));
        var breakerRules = List.of(
                new EnumRule(BooleanNode.TRUE, null, "Closed"),
                new EnumRule(null, "boolean", null));
        index = new SchemaIndex(List.of(coolant),
                Map.of("GENERATOR_BREAKER", breakerRules,
                        "VALVE_MODE", List.of(new EnumRule(TextNode.valueOf("A"), null, "Auto"))));
    }

    @Nested
    @DisplayName("lookups")
    class Lookups {

        @Test
        @DisplayName("group names match ignoring case and spaces")
        void resolveGroupNormalizesName() {
            assertEquals(Set.of("COOLANT_TEMP", "COOLANT_PUMP"), index.resolveGroup("coolant_loop").orElseThrow());
            assertTrue(index.resolveGroup("COOLANT LOOP").isPresent());
            assertTrue(index.resolveGroup("turbine").isEmpty());
        }

        @Test
        @DisplayName("groupOf returns the declaring group")
        void groupOf() {
            assertEquals("Coolant Loop", index.groupOf("coolant temp").orElseThrow());
            assertTrue(index.groupOf("GENERATOR_BREAKER").isEmpty());
        }

        @Test
        @DisplayName("groupNames is sorted")
        void groupNames() {
            assertEquals(List.of("Coolant Loop"), index.groupNames());
        }
    }

    @Nested
    @DisplayName("translate")
    class Translate {

        @Test
        @DisplayName("variable without rules is returned unchanged")
        void noRules() {
            JsonNode raw = DoubleNode.valueOf(72.5);
            assertSame(raw, index.translate("Coolant Loop", "COOLANT_TEMP", raw));
        }

        @Test
        @DisplayName("first exact match wins, numbers compare by value")
        void exactMatch() {
            assertEquals("Running", index.translate("Coolant Loop", "COOLANT_PUMP", IntNode.valueOf(1)).asText());
            assertEquals("Running", index.translate(null, "COOLANT_PUMP", DoubleNode.valueOf(1.0)).asText());
        }

        @Test
        @DisplayName("typed fallback applies when no constant matches")
        void typedFallback() {
            assertEquals("Cycling", index.translate("Coolant Loop", "COOLANT_PUMP", IntNode.valueOf(7)).asText());
        }

        @Test
        @DisplayName("typed fallback without description yields Unknown")
        void typedFallbackWithoutDescription() {
            assertEquals(SchemaIndex.UNKNOWN, index.translate(null, "GENERATOR_BREAKER", BooleanNode.FALSE).asText());
        }

        @Test
        @DisplayName("no match and no typed rule yields Unknown")
        void noMatch() {
            assertEquals(SchemaIndex.UNKNOWN, index.translate(null, "VALVE_MODE", TextNode.valueOf("X")).asText());
        }

        @Test
        @DisplayName("standalone rules apply under any group name")
        void standaloneRules() {
            assertEquals("Closed", index.translate("GENERATOR", "generator breaker", BooleanNode.TRUE).asText());
        }
    }

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("a variable declared in two groups is rejected")
        void duplicateVariable() {
            var a = new SchemaGroup("A", Set.of("SHARED"), Map.of());
            var b = new SchemaGroup("B", Set.of("shared"), Map.of());
            assertThrows(SchemaLoadException.class, () -> new SchemaIndex(List.of(a, b), Map.of()));
        }

        @Test
        @DisplayName("groups that normalize to the same name are rejected")
        void duplicateGroup() {
            var a = new SchemaGroup("Steam Turbine", Set.of(), Map.of());
            var b = new SchemaGroup("STEAM_TURBINE", Set.of(), Map.of());
            assertThrows(SchemaLoadException.class, () -> new SchemaIndex(List.of(a, b), Map.of()));
        }
    }
}

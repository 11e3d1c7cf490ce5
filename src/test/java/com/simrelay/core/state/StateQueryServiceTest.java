package com.simrelay.core.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.simrelay.core.error.BadRequestException;
import com.simrelay.core.error.NotFoundException;
import com.simrelay.core.schema.SchemaIndex;
import com.simrelay.core.schema.SchemaLoader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateQueryServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private StateStore store;
    private StateQueryService service;

    @BeforeEach
    void setUp() {
        SchemaIndex schema = new SchemaLoader(objectMapper).load(new ClassPathResource("schema/test-variables.json"));
        store = new StateStore();
        service = new StateQueryService(store, schema, objectMapper);
    }

    private Snapshot load(String json) throws Exception {
        return store.replace((ObjectNode) objectMapper.readTree(json), "2026-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("every view fails with NotFound before the first snapshot")
    void emptyStore() {
        assertThrows(NotFoundException.class, () -> service.require());
    }

    @Nested
    @DisplayName("byGroup")
    class ByGroup {

        @Test
        @DisplayName("schema members and prefix matches are combined and translated")
        void schemaMembersAndPrefix() throws Exception {
            Snapshot s = load("{\"COOLANT_TEMP\": 72.5, \"COOLANT_PUMP_STATE\": 1, \"CORE_TEMP\": 300}");

            JsonNode result = service.byGroup(s, "COOLANT");

            assertEquals(objectMapper.readTree("{\"COOLANT_TEMP\": 72.5, \"COOLANT_PUMP_STATE\": \"Running\"}"), result);
        }

        @Test
        @DisplayName("group name matching is case-insensitive")
        void caseInsensitive() throws Exception {
            Snapshot s = load("{\"COOLANT_TEMP\": 72.5}");
            assertEquals(72.5, service.byGroup(s, "coolant").get("COOLANT_TEMP").asDouble());
        }

        @Test
        @DisplayName("object-valued top-level key returns its sub-tree")
        void exactKeyObject() throws Exception {
            Snapshot s = load("{\"turbine\": {\"RPM\": 3000, \"TRIP\": false}, \"TURBINE_X\": 1}");

            JsonNode result = service.byGroup(s, "TURBINE");

            assertEquals(objectMapper.readTree("{\"RPM\": 3000, \"TRIP\": false}"), result);
        }

        @Test
        @DisplayName("scalar top-level key resolves as a single translated variable")
        void singleVariable() throws Exception {
            Snapshot s = load("{\"REACTOR_MODE\": \"A\", \"REACTOR_TEMP\": 500}");

            JsonNode result = service.byGroup(s, "reactor_mode");

            assertEquals(objectMapper.readTree("{\"REACTOR_MODE\": \"Automatic\"}"), result);
        }

        @Test
        @DisplayName("ALL and FULL return the raw snapshot")
        void wholeSnapshotAliases() throws Exception {
            Snapshot s = load("{\"COOLANT_PUMP_STATE\": 1}");
            assertEquals(1, service.byGroup(s, "all").get("COOLANT_PUMP_STATE").asInt());
            assertSame(s.data(), service.byGroup(s, "FULL"));
        }

        @Test
        @DisplayName("nothing resolving is NotFound")
        void nothingResolves() throws Exception {
            Snapshot s = load("{\"CORE_TEMP\": 300}");
            assertThrows(NotFoundException.class, () -> service.byGroup(s, "COOLANT"));
        }
    }

    @Nested
    @DisplayName("byPath")
    class ByPath {

        @Test
        @DisplayName("walks objects and arrays")
        void walks() throws Exception {
            Snapshot s = load("{\"A\": {\"B\": [10, 20]}}");
            assertEquals(20, service.byPath(s, List.of("A", "B", "1")).asInt());
            assertEquals(10, service.byPath(s, List.of("a", "b", "0")).asInt());
        }

        @Test
        @DisplayName("out-of-range index is NotFound")
        void outOfRange() throws Exception {
            Snapshot s = load("{\"A\": {\"B\": [10, 20]}}");
            assertThrows(NotFoundException.class, () -> service.byPath(s, List.of("A", "B", "9")));
            assertThrows(NotFoundException.class, () -> service.byPath(s, List.of("A", "B", "-1")));
        }

        @Test
        @DisplayName("unknown key is NotFound")
        void unknownKey() throws Exception {
            Snapshot s = load("{\"A\": {\"B\": [10, 20]}}");
            assertThrows(NotFoundException.class, () -> service.byPath(s, List.of("A", "C")));
        }

        @Test
        @DisplayName("non-integer index into a list is BadRequest")
        void nonIntegerIndex() throws Exception {
            Snapshot s = load("{\"A\": {\"B\": [10, 20]}}");
            assertThrows(BadRequestException.class, () -> service.byPath(s, List.of("A", "B", "first")));
        }

        @Test
        @DisplayName("descending into a scalar is NotFound")
        void intoScalar() throws Exception {
            Snapshot s = load("{\"A\": 5}");
            assertThrows(NotFoundException.class, () -> service.byPath(s, List.of("A", "B")));
        }

        @Test
        @DisplayName("single leaf is translated, deeper paths are raw")
        void translationOnlyForSingleLeaf() throws Exception {
            Snapshot s = load("{\"COOLANT_PUMP_STATE\": 1, \"NESTED\": {\"COOLANT_PUMP_STATE\": 1}}");
            assertEquals("Running", service.byPath(s, List.of("COOLANT_PUMP_STATE")).asText());
            assertEquals(1, service.byPath(s, List.of("NESTED", "COOLANT_PUMP_STATE")).asInt());
        }
    }

    @Test
    @DisplayName("fullData flattens on request")
    void fullDataFlat() throws Exception {
        Snapshot s = load("{\"A\": {\"B\": [10, 20]}, \"C\": 1}");

        JsonNode flat = service.fullData(s, true);

        assertEquals(objectMapper.readTree("{\"A.B[0]\": 10, \"A.B[1]\": 20, \"C\": 1}"), flat);
        assertSame(s.data(), service.fullData(s, false));
    }

    @Test
    @DisplayName("listGroups unions schema groups with inferred ones")
    void listGroups() throws Exception {
        Snapshot s = load("{\"TURBINE\": {\"RPM\": 1}, \"CORE_TEMP\": 1, \"CORE_STATE\": 2, \"ALARM\": true}");

        GroupListing listing = service.listGroups(s);

        assertEquals(List.of("COOLANT", "REACTOR"), listing.schemaGroups());
        assertEquals(List.of("ALARM", "CORE", "TURBINE"), listing.inferredGroups());
        assertEquals("2026-01-01T00:00:00Z", listing.lastUpdated());
    }
}

package com.simrelay.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.simrelay.core.security.CommandTokenFilter;
import com.simrelay.core.security.SignatureVerifier;
import com.simrelay.dispatch.api.StateController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full relay flow against the real application context: signed ingestion, read views,
 * then a command's trip through create, claim and result.
 */
@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = {
        "spring.main.web-application-type=servlet",
        "simrelay.api-key=integration-key",
        "simrelay.command-token=integration-token",
        "simrelay.schema.location=classpath:schema/test-variables.json"
})
class RelayApiIntegrationTest {

    private static final String TOKEN = "integration-token";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("ingest, query, and dispatch a command end to end")
    void fullFlow() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.snapshot.status").value("DEGRADED"));

        String body = """
                {"timestamp":"2026-05-01T12:00:00Z","data":{"COOLANT_TEMP":72.5,"COOLANT_PUMP_STATE":0,
                 "REACTOR_MODE":"Z","pumps":{"p1":{"rpm":1200}}}}""";
        mockMvc.perform(post("/api/state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header(StateController.SIGNATURE_HEADER,
                                SignatureVerifier.sign("integration-key", body.getBytes(StandardCharsets.UTF_8)))
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.updated_keys", hasSize(4)));

        mockMvc.perform(get("/api/state/COOLANT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.COOLANT_PUMP_STATE").value("Stopped"));
        mockMvc.perform(get("/api/state/REACTOR"))
                .andExpect(jsonPath("$.REACTOR_MODE").value("Unrecognized mode"));
        mockMvc.perform(get("/api/state/keys/pumps/p1/rpm"))
                .andExpect(status().isOk())
                .andExpect(content().string("1200"));

        mockMvc.perform(get("/api/commands/next"))
                .andExpect(status().isUnauthorized());

        String created = mockMvc.perform(post("/api/commands")
                        .header(CommandTokenFilter.HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"purpose":"Start coolant pump","priority":5,
                                 "tasks":[{"operation":"pulse","variable":"COOLANT_PUMP_START","value":1,"reset_value":0}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command.status").value("pending"))
                .andExpect(jsonPath("$.command.tasks[0].hold_seconds").value(1.0))
                .andReturn().getResponse().getContentAsString();
        String id = objectMapper.readTree(created).get("command").get("id").asText();

        String claimed = mockMvc.perform(get("/api/commands/next")
                        .header(CommandTokenFilter.HEADER, TOKEN)
                        .param("limit", "5")
                        .param("client_id", "agent-1"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        JsonNode commands = objectMapper.readTree(claimed).get("commands");
        assertEquals(1, commands.size());
        assertEquals(id, commands.get(0).get("id").asText());
        assertEquals("in_progress", commands.get(0).get("status").asText());

        mockMvc.perform(get("/api/commands/next").header(CommandTokenFilter.HEADER, TOKEN))
                .andExpect(jsonPath("$.commands", hasSize(0)));

        mockMvc.perform(post("/api/commands/" + id + "/result")
                        .header(CommandTokenFilter.HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"completed\",\"detail\":\"pulsed\",\"outputs\":[{\"status\":\"ok\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.command.status").value("completed"))
                .andExpect(jsonPath("$.command.claimed_by").value("agent-1"));

        mockMvc.perform(post("/api/commands/" + id + "/result")
                        .header(CommandTokenFilter.HEADER, TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"status\":\"failed\"}"))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/commands/" + id).header(CommandTokenFilter.HEADER, TOKEN))
                .andExpect(jsonPath("$.command.result.detail").value("pulsed"));
        mockMvc.perform(get("/api/commands").header(CommandTokenFilter.HEADER, TOKEN).param("status", "completed"))
                .andExpect(jsonPath("$.commands", hasSize(1)));
    }
}

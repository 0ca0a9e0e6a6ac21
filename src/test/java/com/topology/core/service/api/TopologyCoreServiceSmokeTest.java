package com.topology.core.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.topology.core.service.api.dto.RoundConfigRequest;
import com.topology.core.service.api.dto.RunRoundRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Topology Core Service.
 *
 * Tests basic functionality of all endpoints against an empty topology.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TopologyCoreServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").exists());
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    // ==================== Topology ====================

    @Test
    void currentTopologyStartsEmpty() throws Exception {
        mockMvc.perform(get("/topology"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.version").isNumber())
                .andExpect(jsonPath("$.data.devices").isArray())
                .andExpect(jsonPath("$.data.links").isArray());
    }

    @Test
    void getVersion_unknown_returns404() throws Exception {
        mockMvc.perform(get("/topology/versions/999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void diff_unknownVersion_returns404() throws Exception {
        mockMvc.perform(get("/topology/diff")
                        .param("from", "999998")
                        .param("to", "999999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("VERSION_NOT_FOUND"));
    }

    @Test
    void getDevice_unknown_returns404() throws Exception {
        mockMvc.perform(get("/topology/devices/mac:de:ad:de:ad:de:ad"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void findingsAndAnalysisAvailable() throws Exception {
        mockMvc.perform(get("/topology/findings").param("limit", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());

        mockMvc.perform(get("/topology/analysis"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.graphVersion").isNumber());
    }

    @Test
    void recentEventsAvailable() throws Exception {
        mockMvc.perform(get("/topology/events/recent").param("afterVersion", "0"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    // ==================== Discovery ====================

    @Test
    void runRound_missingTargets_returns400() throws Exception {
        var request = RunRoundRequest.builder().targets(List.of()).build();

        mockMvc.perform(post("/discovery/rounds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.fieldErrors").isArray());
    }

    @Test
    void runRound_targetWithoutAddress_returns400() throws Exception {
        var request = RunRoundRequest.builder()
                .targets(List.of(RunRoundRequest.TargetRequest.builder().mac("aa:bb:cc:dd:ee:ff").build()))
                .build();

        mockMvc.perform(post("/discovery/rounds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void runRound_unknownCredentials_returns400() throws Exception {
        var request = RunRoundRequest.builder()
                .targets(List.of(RunRoundRequest.TargetRequest.builder()
                        .host("10.0.0.1")
                        .credentialsRef("does-not-exist")
                        .build()))
                .build();

        mockMvc.perform(post("/discovery/rounds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("UNKNOWN_CREDENTIALS"));
    }

    @Test
    void runRound_deadlineBeyondOneHour_returns400() throws Exception {
        var request = RunRoundRequest.builder()
                .targets(List.of(RunRoundRequest.TargetRequest.builder().host("10.0.0.1").build()))
                .config(RoundConfigRequest.builder().roundDeadlineMs(Long.MAX_VALUE).build())
                .build();

        mockMvc.perform(post("/discovery/rounds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.error.fieldErrors[0]").value(
                        "config.roundDeadlineMs: roundDeadlineMs must not exceed one hour"));
    }

    @Test
    void runRound_interfaceOnlyTargetWithSnmp_returns400() throws Exception {
        var request = RunRoundRequest.builder()
                .targets(List.of(RunRoundRequest.TargetRequest.builder()
                        .interfaceName("eth0")
                        .probes(List.of("SNMP_QUERY"))
                        .build()))
                .build();

        mockMvc.perform(post("/discovery/rounds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void runInventoryRound_withoutInventory_returns400() throws Exception {
        mockMvc.perform(post("/discovery/rounds/inventory")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void getRound_unknown_returns404() throws Exception {
        mockMvc.perform(get("/discovery/rounds/non-existent"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void listRoundsReturnsArray() throws Exception {
        mockMvc.perform(get("/discovery/rounds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    // ==================== Export ====================

    @Test
    void exportCypherAvailable() throws Exception {
        mockMvc.perform(get("/export/neo4j"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.version").isNumber())
                .andExpect(jsonPath("$.data.cypherStatements").isArray());
    }

    @Test
    void exportUnknownMode_returns400() throws Exception {
        mockMvc.perform(get("/export/neo4j").param("mode", "bogus"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}

package com.processflow.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * End-to-end tests of the REST surface over the in-memory engine.
 */
@SpringBootTest
@AutoConfigureMockMvc
class ProcessFlowApiIntegrationTest {

    private static final String LINEAR = """
        {
          "name": "%s",
          "category": "operations",
          "nodes": [
            {"id": "start", "type": "start", "name": "Start", "connections": ["review"]},
            {"id": "review", "type": "task", "name": "Review", "config": {"assignee": "ops"}, "connections": ["end"]},
            {"id": "end", "type": "end", "name": "End"}
          ]
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void catalogTemplates_shouldBeVisibleToEveryTenant() throws Exception {
        mockMvc.perform(as(get("/api/v1/process-definitions").param("category", "hr"), "carol", "globex"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[?(@.name == 'Employee Onboarding')].version").value("2.1"))
            .andExpect(jsonPath("$[?(@.name == 'Leave Request Process')].tenantId").doesNotExist());
    }

    @Test
    @DisplayName("Start, complete to the end, then read history and replay")
    void processLifecycle_overRest() throws Exception {
        String definitionId = registerDefinition("Rest lifecycle");

        JsonNode started = body(mockMvc.perform(as(post("/api/v1/process-definitions/{id}/start", definitionId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"businessKey\": \"ORD-42\", \"variables\": {\"amount\": 120}, \"priority\": \"high\"}")))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.currentStep").value("start"))
            .andExpect(jsonPath("$.priority").value("high"))
            .andExpect(jsonPath("$.sequenceNumber").value(1))
            .andReturn());
        String instanceId = started.get("instanceId").asText();

        mockMvc.perform(as(post("/api/v1/process-instances/{id}/complete", instanceId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.currentStep").value("review"));
        mockMvc.perform(as(post("/api/v1/process-instances/{id}/complete", instanceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"variables\": {\"approved\": true}}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("completed"))
            .andExpect(jsonPath("$.endTime").exists())
            .andExpect(jsonPath("$.variables.approved").value(true))
            .andExpect(jsonPath("$.variables.review_completedBy").value("alice"));

        mockMvc.perform(as(get("/api/v1/process-instances/{id}/history", instanceId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(3))
            .andExpect(jsonPath("$[0].action").value("process_started"))
            .andExpect(jsonPath("$[2].action").value("task_completed"));

        mockMvc.perform(as(get("/api/v1/process-instances/{id}/history/replay", instanceId).param("sequence", "2")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.currentStep").value("review"));

        mockMvc.perform(as(get("/api/v1/process-instances/{id}/steps", instanceId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[1].assignee").value("ops"))
            .andExpect(jsonPath("$[2].status").value("completed"));

        mockMvc.perform(as(get("/api/v1/process-instances").param("businessKey", "ORD-42").param("status", "completed")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    @Test
    void invalidTransition_shouldReturnConflictWithCurrentStatus() throws Exception {
        String instanceId = startInstance(registerDefinition("Rest conflict"));

        mockMvc.perform(as(patch("/api/v1/process-instances/{id}/resume", instanceId)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("INVALID_STATE_TRANSITION"))
            .andExpect(jsonPath("$.currentStatus").value("running"))
            .andExpect(jsonPath("$.retryable").value(false));
    }

    @Test
    void suspendCancelResume_shouldRejectResume() throws Exception {
        String instanceId = startInstance(registerDefinition("Rest cancel"));

        mockMvc.perform(as(patch("/api/v1/process-instances/{id}/suspend", instanceId)))
            .andExpect(jsonPath("$.status").value("suspended"));
        mockMvc.perform(as(patch("/api/v1/process-instances/{id}/cancel", instanceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"reason\": \"customer withdrew\"}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("cancelled"));
        mockMvc.perform(as(patch("/api/v1/process-instances/{id}/resume", instanceId)))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.currentStatus").value("cancelled"));
        mockMvc.perform(as(get("/api/v1/process-instances/{id}/history", instanceId)))
            .andExpect(jsonPath("$.length()").value(3));
    }

    @Test
    void variables_shouldMergeAndFailRetryShouldRestart() throws Exception {
        String instanceId = startInstance(registerDefinition("Rest variables"));

        mockMvc.perform(as(put("/api/v1/process-instances/{id}/variables", instanceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"region\": \"emea\"}")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.region").value("emea"));

        mockMvc.perform(as(post("/api/v1/process-instances/{id}/fail", instanceId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cause\": \"downstream timeout\"}")))
            .andExpect(jsonPath("$.status").value("failed"));
        mockMvc.perform(as(patch("/api/v1/process-instances/{id}/retry", instanceId)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("running"))
            .andExpect(jsonPath("$.endTime").doesNotExist());

        mockMvc.perform(as(get("/api/v1/process-instances/{id}/variables", instanceId)))
            .andExpect(jsonPath("$.region").value("emea"));
    }

    @Test
    void otherTenant_shouldBeForbidden() throws Exception {
        String instanceId = startInstance(registerDefinition("Rest tenancy"));

        mockMvc.perform(get("/api/v1/process-instances/{id}", instanceId)
                .header("X-User-Id", "mallory")
                .header("X-Tenant-Id", "other-tenant"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorCode").value("ACCESS_DENIED"));
    }

    @Test
    void unknownInstanceAndMissingCaller_shouldBeRejected() throws Exception {
        mockMvc.perform(as(get("/api/v1/process-instances/{id}", UUID.randomUUID())))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.errorCode").value("NOT_FOUND"));

        mockMvc.perform(get("/api/v1/process-instances"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void definitionRules_shouldMapToClientErrors() throws Exception {
        String noStart = """
            {"name": "Rest broken", "nodes": [{"id": "a", "type": "task", "name": "A"}]}
            """;

        mockMvc.perform(as(post("/api/v1/process-definitions/validate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(noStart)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.errors[0].type").value("NO_START_NODE"));

        mockMvc.perform(as(post("/api/v1/process-definitions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(noStart)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("DEFINITION_VALIDATION_FAILED"));

        String definitionId = registerDefinition("Rest duplicate");
        mockMvc.perform(as(post("/api/v1/process-definitions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(LINEAR.formatted("Rest duplicate"))))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorCode").value("DUPLICATE_DEFINITION"));

        mockMvc.perform(as(post("/api/v1/process-definitions/{id}/deactivate", definitionId)))
            .andExpect(jsonPath("$.active").value(false));
        mockMvc.perform(as(post("/api/v1/process-definitions/{id}/start", definitionId)))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("NOT_INSTANTIABLE"));
    }

    private String registerDefinition(String name) throws Exception {
        MvcResult result = mockMvc.perform(as(post("/api/v1/process-definitions")
                .contentType(MediaType.APPLICATION_JSON)
                .content(LINEAR.formatted(name))))
            .andExpect(status().isCreated())
            .andReturn();
        return body(result).get("definitionId").asText();
    }

    private String startInstance(String definitionId) throws Exception {
        MvcResult result = mockMvc.perform(as(post("/api/v1/process-definitions/{id}/start", definitionId)))
            .andExpect(status().isCreated())
            .andReturn();
        return body(result).get("instanceId").asText();
    }

    private JsonNode body(MvcResult result) throws Exception {
        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        assertThat(json).isNotNull();
        return json;
    }

    private static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request) {
        return as(request, "alice", "acme");
    }

    private static MockHttpServletRequestBuilder as(MockHttpServletRequestBuilder request, String user, String tenant) {
        return request.header("X-User-Id", user).header("X-Tenant-Id", tenant);
    }
}

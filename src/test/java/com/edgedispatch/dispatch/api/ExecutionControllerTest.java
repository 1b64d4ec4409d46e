package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionDispatcher;
import com.edgedispatch.core.execution.ExecutionFailureKind;
import com.edgedispatch.core.execution.ExecutionNotFoundException;
import com.edgedispatch.core.execution.ExecutionRecord;
import com.edgedispatch.core.execution.ExecutionRequest;
import com.edgedispatch.core.execution.ExecutionStatus;
import com.edgedispatch.core.execution.ExecutionValidationException;
import com.edgedispatch.core.execution.RemoteExecutor;
import com.edgedispatch.core.execution.Transport;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ExecutionController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ExecutionControllerTest {

    private static final Instant SUBMITTED = Instant.parse("2026-01-15T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ExecutionDispatcher dispatcher;

    // ── POST /api/v1/executions ──────────────────────────────────────

    @Test
    @DisplayName("POST /executions returns 202 Accepted with execution_id")
    void submitCommand() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn("exec-jetson-01-1700000000000000000");

        String body = objectMapper.writeValueAsString(
                new ExecutionSubmitRequest("jetson-01", List.of("docker", "ps"), null, null));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execution_id").value("exec-jetson-01-1700000000000000000"))
                .andExpect(jsonPath("$.status").value("accepted"))
                .andExpect(jsonPath("$.message").value("Command dispatched"));
    }

    @Test
    @DisplayName("POST /executions maps snake_case fields onto the request")
    void submitDeploymentMapsFields() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn("exec-jetson-01-1");

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"jetson-01\",\"app_type\":\"zed\",\"app_url\":\"dummy-zed:latest\"}"))
                .andExpect(status().isAccepted());

        var captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(dispatcher).dispatch(captor.capture());
        assertEquals(new ExecutionRequest("jetson-01", List.of(), "zed", "dummy-zed:latest"), captor.getValue());
    }

    @Test
    @DisplayName("POST /executions with invalid request returns 400")
    void submitInvalid() throws Exception {
        when(dispatcher.dispatch(any())).thenThrow(new ExecutionValidationException("device_id is required"));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"command\":[\"uptime\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("device_id is required"))
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    @DisplayName("POST /executions with a null command element returns 400")
    void submitNullCommandElement() throws Exception {
        when(dispatcher.dispatch(any()))
                .thenThrow(new ExecutionValidationException("command array must not contain null or blank elements"));

        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"jetson-01\",\"command\":[\"ls\",null]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("command array must not contain null or blank elements"))
                .andExpect(jsonPath("$.status").value("error"));

        var captor = ArgumentCaptor.forClass(ExecutionRequest.class);
        verify(dispatcher).dispatch(captor.capture());
        assertEquals(Arrays.asList("ls", null), captor.getValue().command());
    }

    @Test
    @DisplayName("POST /executions with malformed JSON returns 400")
    void submitMalformed() throws Exception {
        mockMvc.perform(post("/api/v1/executions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    // ── GET /api/v1/executions/{id} ──────────────────────────────────

    @Test
    @DisplayName("GET /executions/{id} returns pending record with empty output")
    void getPending() throws Exception {
        when(dispatcher.getStatus("exec-jetson-01-1"))
                .thenReturn(ExecutionRecord.pending("exec-jetson-01-1", "jetson-01", SUBMITTED));

        mockMvc.perform(get("/api/v1/executions/exec-jetson-01-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.execution_id").value("exec-jetson-01-1"))
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.message").value("ok"))
                .andExpect(jsonPath("$.output").value(""))
                .andExpect(jsonPath("$.error").value(""));
    }

    @Test
    @DisplayName("GET /executions/{id} returns failure details")
    void getFailed() throws Exception {
        var record = new ExecutionRecord("exec-jetson-01-1", "jetson-01", ExecutionStatus.ERROR,
                "permission denied", "exit status 1", ExecutionFailureKind.EXECUTION_FAILURE,
                Transport.OVERLAY, RemoteExecutor.Stage.FALLBACK_ATTEMPTED, false, SUBMITTED, SUBMITTED.plusSeconds(4));
        when(dispatcher.getStatus("exec-jetson-01-1")).thenReturn(record);

        mockMvc.perform(get("/api/v1/executions/exec-jetson-01-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.error").value("exit status 1"))
                .andExpect(jsonPath("$.failure_kind").value("EXECUTION_FAILURE"))
                .andExpect(jsonPath("$.transport").value("overlay"))
                .andExpect(jsonPath("$.stage").value("fallback_attempted"))
                .andExpect(jsonPath("$.probe_reachable").value(false))
                .andExpect(jsonPath("$.completed_at").exists());
    }

    @Test
    @DisplayName("GET /executions/{id} for unknown id returns 404")
    void getUnknown() throws Exception {
        when(dispatcher.getStatus("exec-nope-1")).thenThrow(new ExecutionNotFoundException("exec-nope-1"));

        mockMvc.perform(get("/api/v1/executions/exec-nope-1"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("execution id not found"))
                .andExpect(jsonPath("$.status").value("error"));
    }

    // ── GET /api/v1/executions ───────────────────────────────────────

    @Test
    @DisplayName("GET /executions lists records")
    void listExecutions() throws Exception {
        when(dispatcher.listExecutions()).thenReturn(List.of(
                ExecutionRecord.pending("exec-jetson-02-2", "jetson-02", SUBMITTED),
                ExecutionRecord.pending("exec-jetson-01-1", "jetson-01", SUBMITTED)));

        mockMvc.perform(get("/api/v1/executions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].execution_id").value("exec-jetson-02-2"))
                .andExpect(jsonPath("$[1].device_id").value("jetson-01"));
    }
}

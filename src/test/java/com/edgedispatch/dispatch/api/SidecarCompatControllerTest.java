package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.execution.ExecutionDispatcher;
import com.edgedispatch.core.execution.ExecutionNotFoundException;
import com.edgedispatch.core.execution.ExecutionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(SidecarCompatController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class SidecarCompatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ExecutionDispatcher dispatcher;

    @Test
    @DisplayName("POST /ssh/exec accepts like the versioned route")
    void sshExec() throws Exception {
        when(dispatcher.dispatch(any())).thenReturn("exec-jetson-01-1");

        mockMvc.perform(post("/ssh/exec")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"device_id\":\"jetson-01\",\"command\":[\"uptime\"]}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.execution_id").value("exec-jetson-01-1"))
                .andExpect(jsonPath("$.status").value("accepted"));
    }

    @Test
    @DisplayName("GET /deployments/status?id= returns the record")
    void deploymentStatus() throws Exception {
        when(dispatcher.getStatus("exec-jetson-01-1"))
                .thenReturn(ExecutionRecord.pending("exec-jetson-01-1", "jetson-01", Instant.now()));

        mockMvc.perform(get("/deployments/status").param("id", "exec-jetson-01-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("pending"));
    }

    @Test
    @DisplayName("GET /deployments/status without id returns 400")
    void deploymentStatusMissingId() throws Exception {
        mockMvc.perform(get("/deployments/status"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("execution id required (query param id)"));

        verifyNoInteractions(dispatcher);
    }

    @Test
    @DisplayName("GET /deployments/status for unknown id returns 404")
    void deploymentStatusUnknown() throws Exception {
        when(dispatcher.getStatus("exec-nope-1")).thenThrow(new ExecutionNotFoundException("exec-nope-1"));

        mockMvc.perform(get("/deployments/status").param("id", "exec-nope-1"))
                .andExpect(status().isNotFound());
    }
}

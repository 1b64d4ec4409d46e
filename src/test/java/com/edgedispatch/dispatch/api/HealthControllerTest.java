package com.edgedispatch.dispatch.api;

import com.edgedispatch.core.health.HealthCheckService;
import com.edgedispatch.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("GET /health returns 200 once the overlay is ready")
    void ready() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("overlay", HealthStatus.Status.UP, "Overlay network initialized", Map.of()),
                new HealthStatus("dispatcher", HealthStatus.Status.UP, "Accepting executions (0 in flight)", Map.of())));
        when(healthCheckService.isOverlayReady()).thenReturn(true);

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.overlay_ready").value(true))
                .andExpect(jsonPath("$.components.overlay.status").value("UP"))
                .andExpect(jsonPath("$.version").exists())
                .andExpect(jsonPath("$.time").exists());
    }

    @Test
    @DisplayName("GET /health returns 503 while the overlay is down")
    void notReady() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("overlay", HealthStatus.Status.DOWN,
                        "Overlay network not initialized (TS_AUTHKEY not set)", Map.of()),
                new HealthStatus("dispatcher", HealthStatus.Status.UP, "Accepting executions (0 in flight)", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.overlay_ready").value(false))
                .andExpect(jsonPath("$.components.overlay.detail")
                        .value("Overlay network not initialized (TS_AUTHKEY not set)"));
    }
}

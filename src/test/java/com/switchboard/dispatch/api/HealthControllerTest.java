package com.switchboard.dispatch.api;

import com.switchboard.core.health.HealthCheckService;
import com.switchboard.core.health.HealthStatus;
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
    @DisplayName("GET /health reports the worst status and stays 200 while nothing is down")
    void healthDegraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.UP, "Shared store reachable (memory)",
                        Map.of("backend", "memory")),
                new HealthStatus("swarm", HealthStatus.Status.DEGRADED, "Swarm is paused", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.store.metadata.backend").value("memory"))
                .andExpect(jsonPath("$.components.swarm.status").value("DEGRADED"))
                .andExpect(jsonPath("$.components.swarm.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /health is UP when every component is UP")
    void healthUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.UP, "Shared store reachable (memory)", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    @DisplayName("GET /health returns 503 when a component is down")
    void healthDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.DOWN, "Store error: timeout", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }
}

package com.wirevizweb.dispatch.api;

import com.wirevizweb.core.health.HealthCheckService;
import com.wirevizweb.core.health.HealthStatus;
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
    @DisplayName("GET /api/v1/health returns 200 when nothing is DOWN")
    void healthUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("engine", HealthStatus.Status.UP, "Rendering engine found: wireviz", Map.of()),
                new HealthStatus("workspace", HealthStatus.Status.DEGRADED, "Work root does not exist yet",
                        Map.of("path", "/var/tmp/wireviz"))));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.engine.status").value("UP"))
                .andExpect(jsonPath("$.components.workspace.metadata.path").value("/var/tmp/wireviz"));
    }

    @Test
    @DisplayName("GET /api/v1/health returns 503 when the engine is DOWN")
    void healthDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("engine", HealthStatus.Status.DOWN, "Rendering engine not found: wireviz", Map.of())));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"))
                .andExpect(jsonPath("$.components.engine.detail").value("Rendering engine not found: wireviz"));
    }
}

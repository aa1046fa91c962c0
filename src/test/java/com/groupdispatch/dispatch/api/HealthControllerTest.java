package com.groupdispatch.dispatch.api;

import com.groupdispatch.core.health.HealthCheckService;
import com.groupdispatch.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
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

    private static HealthStatus component(String name, HealthStatus.Status status) {
        return new HealthStatus(name, status, name + " is " + status, Map.of());
    }

    @Test
    @DisplayName("GET /api/v1/health returns 200 when every component is up")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("store", HealthStatus.Status.UP, "ok", Map.of("backend", "sqlite")),
                component("sandbox", HealthStatus.Status.UP)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("UP")))
                .andExpect(jsonPath("$.components.store.metadata.backend", is("sqlite")))
                .andExpect(jsonPath("$.components.sandbox.status", is("UP")))
                .andExpect(jsonPath("$.components.sandbox.metadata").doesNotExist());
    }

    @Test
    @DisplayName("GET /api/v1/health returns 503 when a component is down")
    void componentDown() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                component("store", HealthStatus.Status.UP),
                component("sandbox", HealthStatus.Status.DOWN)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status", is("DOWN")))
                .andExpect(jsonPath("$.components.sandbox.detail", containsString("DOWN")));
    }

    @Test
    @DisplayName("GET /api/v1/health stays 200 while degraded")
    void degraded() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                component("engine", HealthStatus.Status.DEGRADED),
                component("store", HealthStatus.Status.UP)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status", is("DEGRADED")));
    }

    @Test
    @DisplayName("overall prefers DOWN over DEGRADED regardless of order")
    void overall() {
        assertEquals(HealthStatus.Status.UP, HealthController.overall(List.of()));
        assertEquals(HealthStatus.Status.DOWN, HealthController.overall(List.of(
                component("engine", HealthStatus.Status.DEGRADED),
                component("store", HealthStatus.Status.DOWN))));
        assertEquals(HealthStatus.Status.DEGRADED, HealthController.overall(List.of(
                component("store", HealthStatus.Status.UP),
                component("engine", HealthStatus.Status.DEGRADED))));
    }
}

package com.httpmonitor.api;

import com.httpmonitor.model.ErrorCategory;
import com.httpmonitor.model.HealthCheck;
import com.httpmonitor.model.HealthStatus;
import com.httpmonitor.model.HealthSummaryResponse;
import com.httpmonitor.model.HttpMethod;
import com.httpmonitor.model.Target;
import com.httpmonitor.model.TargetHealthSnapshot;
import com.httpmonitor.service.MonitorService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(MonitorController.class)
public class MonitorControllerTest {
    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MonitorService service;

    private static TargetHealthSnapshot snapshot(HealthCheck check) {
        return new TargetHealthSnapshot("API", "https://example.com/health", HealthStatus.HEALTHY, 0, 1, 1, 100.0,
            Duration.ofMillis(120), Duration.ofMillis(120), Duration.ofMillis(120),
            Instant.parse("2024-01-01T00:00:00Z"), 1.0, List.of(check));
    }

    private static HealthCheck check() {
        return new HealthCheck("API", Instant.parse("2024-01-01T00:00:00Z"), true, 200, Duration.ofMillis(120),
            ErrorCategory.NONE, null, null);
    }

    @Test
    void listTargetsReturnsConfiguredTargets() throws Exception {
        Target target = new Target("API", "https://example.com/health", HttpMethod.GET, Map.of(), List.of(200),
            null, Duration.ofSeconds(5), Duration.ofSeconds(30));
        when(service.listTargets()).thenReturn(List.of(target));

        mockMvc.perform(get("/api/targets"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].name", is("API")))
            .andExpect(jsonPath("$[0].expectedStatus[0]", is(200)));
    }

    @Test
    void healthOfKnownTarget() throws Exception {
        when(service.snapshot("API")).thenReturn(snapshot(check()));

        mockMvc.perform(get("/api/health/targets/API"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status", is("HEALTHY")))
            .andExpect(jsonPath("$.uptimePercentage", is(100.0)))
            .andExpect(jsonPath("$.averageResponseTimeMs", is(120)))
            .andExpect(jsonPath("$.healthScore", is(1.0)))
            .andExpect(jsonPath("$.recentChecks").doesNotExist());
    }

    @Test
    void healthOfUnknownTargetIsNotFound() throws Exception {
        when(service.snapshot("missing")).thenReturn(null);

        mockMvc.perform(get("/api/health/targets/missing"))
            .andExpect(status().isNotFound());
    }

    @Test
    void recentChecksOfKnownTarget() throws Exception {
        when(service.recentChecks("API")).thenReturn(List.of(check()));

        mockMvc.perform(get("/api/health/targets/API/checks"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(1)))
            .andExpect(jsonPath("$[0].success", is(true)))
            .andExpect(jsonPath("$[0].statusCode", is(200)))
            .andExpect(jsonPath("$[0].responseTimeMs", is(120)));
    }

    @Test
    void recentChecksOfUnknownTargetIsNotFound() throws Exception {
        when(service.recentChecks("missing")).thenReturn(null);

        mockMvc.perform(get("/api/health/targets/missing/checks"))
            .andExpect(status().isNotFound());
    }

    @Test
    void summaryCountsStatuses() throws Exception {
        when(service.getSummary()).thenReturn(new HealthSummaryResponse(
            Map.of(HealthStatus.HEALTHY, 2L, HealthStatus.UNHEALTHY, 1L), 3, Instant.parse("2024-01-01T00:00:00Z")));

        mockMvc.perform(get("/api/health/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.targetCount", is(3)))
            .andExpect(jsonPath("$.statusCounts.HEALTHY", is(2)))
            .andExpect(jsonPath("$.statusCounts.UNHEALTHY", is(1)));
    }
}

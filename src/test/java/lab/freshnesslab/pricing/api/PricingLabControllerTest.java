package lab.freshnesslab.pricing.api;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.domain.BackendSnapshot;
import lab.freshnesslab.pricing.domain.MetricsSnapshot;
import lab.freshnesslab.pricing.domain.PriceRow;
import lab.freshnesslab.pricing.domain.ProbeResult;
import lab.freshnesslab.pricing.domain.WindowStats;
import lab.freshnesslab.pricing.exception.InvalidRefreshIntervalException;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import lab.freshnesslab.pricing.exception.RefreshFailedException;
import lab.freshnesslab.pricing.service.LoadGenerator;
import lab.freshnesslab.pricing.service.MaterializedViewRefresher;
import lab.freshnesslab.pricing.service.MetricsReportService;
import lab.freshnesslab.pricing.service.ProbeExecutor;
import lab.freshnesslab.pricing.service.StreamingAdminService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(PricingLabController.class)
class PricingLabControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private MetricsReportService reportService;

    @MockBean
    private MaterializedViewRefresher refresher;

    @MockBean
    private LoadGenerator loadGenerator;

    @MockBean
    private ProbeExecutor probeExecutor;

    @MockBean
    private StreamingAdminService streamingAdmin;

    @Test
    @DisplayName("Metrics endpoint returns every backend keyed by stats key")
    void metricsSnapshot() throws Exception {
        Map<String, BackendSnapshot> backends = new LinkedHashMap<>();
        backends.put("view", new BackendSnapshot(5.0, 2.0, 1200.0, new BigDecimal("10.50"), null, null,
                new WindowStats(3.0, 2.0, 3.0), WindowStats.EMPTY, null));
        backends.put("materialized_view", BackendSnapshot.unavailable());
        backends.put("materialize", BackendSnapshot.unavailable());
        when(reportService.getSnapshot(1L))
                .thenReturn(new MetricsSnapshot(1L, 1714557600000L, "serializable", 60, backends));

        mockMvc.perform(get("/lab/metrics/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isolationLevel").value("serializable"))
                .andExpect(jsonPath("$.refreshIntervalSeconds").value(60))
                .andExpect(jsonPath("$.backends.view.qps").value(5.0))
                .andExpect(jsonPath("$.backends.view.price").value(10.50))
                .andExpect(jsonPath("$.backends.materialize.qps").doesNotExist());
    }

    @Test
    void metricsWithoutBaselinePoolIsUnavailable() throws Exception {
        when(reportService.getSnapshot(1L)).thenThrow(new PoolUnavailableException(BackendFamily.POSTGRES));

        mockMvc.perform(get("/lab/metrics/1"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    @DisplayName("Invalid refresh interval is a bad request")
    void invalidRefreshInterval() throws Exception {
        doThrow(new InvalidRefreshIntervalException(0, 1)).when(refresher).setRefreshInterval(0);

        mockMvc.perform(post("/lab/configure-refresh-interval/0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Interval must be at least 1 second(s), got 0"));
    }

    @Test
    void configureRefreshInterval() throws Exception {
        when(refresher.getRefreshInterval()).thenReturn(15);

        mockMvc.perform(post("/lab/configure-refresh-interval/15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.refreshInterval").value(15));

        verify(refresher).setRefreshInterval(15);
    }

    @Test
    void forcedRefreshReportsDuration() throws Exception {
        when(refresher.refreshOnce()).thenReturn(Duration.ofMillis(1500));

        mockMvc.perform(post("/lab/refresh"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.durationSeconds").value(1.5));
    }

    @Test
    void failedRefreshIsServerError() throws Exception {
        when(refresher.refreshOnce())
                .thenThrow(new RefreshFailedException("mv_dynamic_pricing", new IllegalStateException("lock timeout")));

        mockMvc.perform(post("/lab/refresh"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void toggleTraffic() throws Exception {
        Map<Backend, Integer> limits = new EnumMap<>(Backend.class);
        limits.put(Backend.STREAMING, 2);
        when(loadGenerator.isTrafficEnabled(Backend.STREAMING)).thenReturn(false);
        when(loadGenerator.currentLimits()).thenReturn(limits);

        mockMvc.perform(post("/lab/traffic/materialize").param("enabled", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("materialize"))
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.limit").value(2));

        verify(loadGenerator).setTrafficEnabled(Backend.STREAMING, false);
    }

    @Test
    void unknownBackendIsBadRequest() throws Exception {
        mockMvc.perform(post("/lab/probe/redis"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(probeExecutor);
    }

    @Test
    void probeBackend() throws Exception {
        when(probeExecutor.probe(Backend.CACHED_TABLE)).thenReturn(new ProbeResult(Backend.CACHED_TABLE,
                Duration.ofMillis(4), new PriceRow(1L, new BigDecimal("8.25"), null)));

        mockMvc.perform(post("/lab/probe/mv"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("materialized_view"))
                .andExpect(jsonPath("$.succeeded").value(true))
                .andExpect(jsonPath("$.latencyMs").value(4.0))
                .andExpect(jsonPath("$.price").value(8.25));
    }

    @Test
    void toggleViewIndex() throws Exception {
        when(streamingAdmin.toggleReadinessIndex()).thenReturn(true);

        mockMvc.perform(post("/lab/toggle-view-index"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.indexExists").value(true))
                .andExpect(jsonPath("$.message").value("Index created successfully"));
    }

    @Test
    void toggleIsolation() throws Exception {
        when(streamingAdmin.toggleIsolationLevel()).thenReturn("strict serializable");

        mockMvc.perform(post("/lab/toggle-isolation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isolationLevel").value("strict serializable"));
    }

    @Test
    void resetProbeSummary() throws Exception {
        mockMvc.perform(post("/lab/probes/reset"))
                .andExpect(status().isNoContent());

        verify(reportService).resetProbeSummary();
    }
}

package lab.freshnesslab.pricing.service;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.domain.BackendSnapshot;
import lab.freshnesslab.pricing.domain.MetricsSnapshot;
import lab.freshnesslab.pricing.domain.WindowStats;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import lab.freshnesslab.pricing.lab.ProbeMetricsCollector;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import lab.freshnesslab.pricing.stats.StatsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsReportServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private ConnectionPoolManager poolManager;

    @Mock
    private StatsStore statsStore;

    @Mock
    private MaterializedViewRefresher refresher;

    @Mock
    private ProbeMetricsCollector probeMetrics;

    private MetricsReportService reportService;

    @BeforeEach
    void setUp() {
        reportService = new MetricsReportService(poolManager, statsStore, refresher, probeMetrics,
                new FreshnessLabProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Snapshot combines every backend with isolation level and refresh interval")
    void snapshotCombinesBackends() {
        BackendSnapshot live = new BackendSnapshot(4.0, 2.5, 800.0, new BigDecimal("12.30"), 0.4, null,
                new WindowStats(3.0, 2.5, 3.0), new WindowStats(900.0, 800.0, 900.0), null);
        when(poolManager.isAvailable(BackendFamily.POSTGRES)).thenReturn(true);
        when(poolManager.isolationLevel()).thenReturn("serializable");
        when(refresher.getRefreshInterval()).thenReturn(60);
        when(statsStore.snapshot(Backend.BASELINE)).thenReturn(live);
        when(statsStore.snapshot(Backend.CACHED_TABLE)).thenReturn(BackendSnapshot.unavailable());
        when(statsStore.snapshot(Backend.STREAMING)).thenReturn(live);

        MetricsSnapshot snapshot = reportService.getSnapshot(1L);

        assertEquals(1L, snapshot.productId());
        assertEquals(NOW.toEpochMilli(), snapshot.timestamp());
        assertEquals("serializable", snapshot.isolationLevel());
        assertEquals(60, snapshot.refreshIntervalSeconds());
        assertEquals(live, snapshot.backends().get("view"));
        assertNull(snapshot.backends().get("materialized_view").qps());
        assertEquals(live, snapshot.backends().get("materialize"));
    }

    @Test
    void snapshotRequiresBaselinePool() {
        when(poolManager.isAvailable(BackendFamily.POSTGRES)).thenReturn(false);

        assertThrows(PoolUnavailableException.class, () -> reportService.getSnapshot(1L));
        verifyNoInteractions(statsStore);
    }

    @Test
    @DisplayName("Resetting the summary also clears the rolling statistics")
    void resetClearsCollectorAndStats() {
        reportService.resetProbeSummary();

        verify(probeMetrics).reset();
        verify(statsStore).reset();
        verifyNoInteractions(poolManager);
    }

    @Test
    void databaseSizeInGigabytes() throws SQLException {
        Connection connection = mock(Connection.class);
        PreparedStatement statement = mock(PreparedStatement.class);
        ResultSet resultSet = mock(ResultSet.class);
        when(poolManager.acquire(BackendFamily.POSTGRES))
                .thenReturn(new LabConnection(connection, BackendFamily.POSTGRES));
        when(connection.prepareStatement("SELECT pg_database_size(current_database())")).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.next()).thenReturn(true);
        when(resultSet.getLong(1)).thenReturn(3L * 1024 * 1024 * 1024);

        assertEquals(3.0, reportService.databaseSizeGb(), 1e-9);
    }

    @Test
    void databaseSizeFailureReadsAsZero() throws SQLException {
        when(poolManager.acquire(BackendFamily.POSTGRES)).thenThrow(new SQLException("connection refused", "08001"));

        assertEquals(0.0, reportService.databaseSizeGb());
    }
}

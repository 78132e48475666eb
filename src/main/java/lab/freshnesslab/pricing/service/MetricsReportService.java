package lab.freshnesslab.pricing.service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.domain.BackendSnapshot;
import lab.freshnesslab.pricing.domain.MetricsSnapshot;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import lab.freshnesslab.pricing.lab.ProbeMetricsCollector;
import lab.freshnesslab.pricing.lab.ProbeMetricsSnapshot;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import lab.freshnesslab.pricing.stats.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class MetricsReportService {

    private static final Logger log = LoggerFactory.getLogger(MetricsReportService.class);
    private static final double BYTES_PER_GB = 1024.0 * 1024.0 * 1024.0;

    private final ConnectionPoolManager poolManager;
    private final StatsStore statsStore;
    private final MaterializedViewRefresher refresher;
    private final ProbeMetricsCollector probeMetrics;
    private final FreshnessLabProperties properties;
    private final Clock clock;

    public MetricsReportService(ConnectionPoolManager poolManager,
                                StatsStore statsStore,
                                MaterializedViewRefresher refresher,
                                ProbeMetricsCollector probeMetrics,
                                FreshnessLabProperties properties,
                                Clock clock) {
        this.poolManager = poolManager;
        this.statsStore = statsStore;
        this.refresher = refresher;
        this.probeMetrics = probeMetrics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Current per-backend view. Backends without a recent observation come back with every field null.
     */
    public MetricsSnapshot getSnapshot(long productId) {
        if (!poolManager.isAvailable(BackendFamily.POSTGRES)) {
            throw new PoolUnavailableException(BackendFamily.POSTGRES);
        }
        if (productId != properties.getProductId()) {
            log.debug("Snapshot requested for untracked product productId={} tracked={}",
                    productId, properties.getProductId());
        }
        Map<String, BackendSnapshot> backends = new LinkedHashMap<>();
        for (Backend backend : Backend.values()) {
            backends.put(backend.statsKey(), statsStore.snapshot(backend));
        }
        return new MetricsSnapshot(productId,
                clock.millis(),
                poolManager.isolationLevel(),
                refresher.getRefreshInterval(),
                backends);
    }

    public ProbeMetricsSnapshot probeSummary() {
        return probeMetrics.metricsSnapshot();
    }

    /**
     * Starts a fresh measurement: lifetime histograms and the rolling windows are cleared together.
     */
    public void resetProbeSummary() {
        probeMetrics.reset();
        statsStore.reset();
        log.info("Probe summary and rolling statistics reset");
    }

    /**
     * Size of the baseline database in GB; 0.0 when the query fails.
     */
    public double databaseSizeGb() {
        try (LabConnection connection = poolManager.acquire(BackendFamily.POSTGRES);
             PreparedStatement statement = connection.prepareStatement(
                     "SELECT pg_database_size(current_database())")) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    log.error("Database size query returned no row");
                    return 0.0;
                }
                return resultSet.getLong(1) / BYTES_PER_GB;
            }
        } catch (SQLException | LabBackendException ex) {
            log.error("Error getting database size message={}", ex.getMessage());
            return 0.0;
        }
    }
}

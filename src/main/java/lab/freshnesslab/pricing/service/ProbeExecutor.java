package lab.freshnesslab.pricing.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.PriceRow;
import lab.freshnesslab.pricing.domain.ProbeResult;
import lab.freshnesslab.pricing.exception.BackendNotReadyException;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import lab.freshnesslab.pricing.exception.ProbeTimeoutException;
import lab.freshnesslab.pricing.lab.ProbeMetricsCollector;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import lab.freshnesslab.pricing.pool.SqlStates;
import lab.freshnesslab.pricing.stats.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/**
 * Runs the canonical price lookup against one backend and records the outcome.
 */
@Component
public class ProbeExecutor {

    private static final Logger log = LoggerFactory.getLogger(ProbeExecutor.class);
    private static final String PROBE_SQL =
            "SELECT product_id, adjusted_price, last_update_time FROM %s WHERE product_id = ?";

    private final ConnectionPoolManager poolManager;
    private final StatsStore statsStore;
    private final ProbeMetricsCollector probeMetrics;
    private final FreshnessLabProperties properties;
    private final Map<Backend, Timer> successTimers = new EnumMap<>(Backend.class);
    private final Map<Backend, Timer> errorTimers = new EnumMap<>(Backend.class);

    public ProbeExecutor(ConnectionPoolManager poolManager,
                         StatsStore statsStore,
                         ProbeMetricsCollector probeMetrics,
                         FreshnessLabProperties properties,
                         ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.poolManager = poolManager;
        this.statsStore = statsStore;
        this.probeMetrics = probeMetrics;
        this.properties = properties;
        MeterRegistry registry = meterRegistryProvider.getIfAvailable();
        if (registry != null) {
            for (Backend backend : Backend.values()) {
                successTimers.put(backend, Timer.builder("lab.probe")
                        .tag("backend", backend.statsKey())
                        .tag("result", "success")
                        .register(registry));
                errorTimers.put(backend, Timer.builder("lab.probe")
                        .tag("backend", backend.statsKey())
                        .tag("result", "error")
                        .register(registry));
            }
        }
    }

    /**
     * Looks up the configured product on {@code backend}. A failed lookup yields a result with a
     * null row; its duration is still recorded. Throws only when the backend has no pool at all.
     */
    public ProbeResult probe(Backend backend) {
        if (!poolManager.isAvailable(backend.family())) {
            throw new PoolUnavailableException(backend.family());
        }
        long startedNs = System.nanoTime();
        PriceRow row = null;
        LabBackendException failure = null;
        try {
            row = query(backend);
        } catch (SQLException ex) {
            failure = classify(backend, ex, Duration.ofNanos(System.nanoTime() - startedNs));
        } catch (LabBackendException ex) {
            failure = ex;
        }
        long durationNs = System.nanoTime() - startedNs;
        Duration duration = Duration.ofNanos(durationNs);

        statsStore.recordObservation(backend, duration, row);
        if (failure == null) {
            probeMetrics.recordSuccess(backend, durationNs);
            recordTimer(successTimers.get(backend), durationNs);
        } else {
            probeMetrics.recordFail(backend, durationNs);
            recordTimer(errorTimers.get(backend), durationNs);
            handleFailure(backend, failure);
        }
        return new ProbeResult(backend, duration, row);
    }

    private PriceRow query(Backend backend) throws SQLException {
        String sql = String.format(PROBE_SQL, qualifiedRelation(backend));
        try (LabConnection connection = poolManager.acquire(backend.family());
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            statement.setLong(1, properties.getProductId());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    log.debug("No row for product backend={} productId={}",
                            backend.displayName(), properties.getProductId());
                    return null;
                }
                BigDecimal price = resultSet.getBigDecimal("adjusted_price");
                OffsetDateTime updated = resultSet.getObject("last_update_time", OffsetDateTime.class);
                Instant lastUpdateTime = updated == null ? null : updated.toInstant();
                return new PriceRow(resultSet.getLong("product_id"), price, lastUpdateTime);
            }
        }
    }

    private String qualifiedRelation(Backend backend) {
        FreshnessLabProperties.BackendConnection settings = backend == Backend.STREAMING
                ? properties.getStreaming()
                : properties.getBaseline();
        return settings.getSchema() + "." + backend.relation();
    }

    private LabBackendException classify(Backend backend, SQLException ex, Duration elapsed) {
        if (SqlStates.isTimeout(ex)) {
            return new ProbeTimeoutException(backend, elapsed, ex);
        }
        if (SqlStates.isUndefinedRelation(ex)) {
            return new BackendNotReadyException(backend.family(), ex);
        }
        return new LabBackendException(backend.displayName() + " query failed: " + ex.getMessage(),
                backend.family(), !SqlStates.isConnectionLoss(ex), ex);
    }

    private void handleFailure(Backend backend, LabBackendException failure) {
        if (backend == Backend.STREAMING
                && (failure instanceof ProbeTimeoutException || failure instanceof BackendNotReadyException)) {
            log.warn("Streaming probe failed, marking unavailable message={}", failure.getMessage());
            statsStore.markUnavailable(backend);
            return;
        }
        log.warn("Probe failed backend={} retryable={} message={}",
                backend.displayName(), failure.isRetryable(), failure.getMessage());
    }

    private void recordTimer(Timer timer, long durationNs) {
        if (timer == null) {
            return;
        }
        if (durationNs > 0L) {
            timer.record(durationNs, TimeUnit.NANOSECONDS);
        }
    }
}

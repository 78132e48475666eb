package lab.freshnesslab.pricing.service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.OffsetDateTime;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.domain.BaselineHeartbeat;
import lab.freshnesslab.pricing.domain.Heartbeat;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import lab.freshnesslab.pricing.pool.SqlStates;
import lab.freshnesslab.pricing.stats.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Derives freshness for the two non-live backends.
 *
 * <p>Streaming lag compares the newest heartbeat on each side. Both timestamps in the lag formula
 * come from the baseline server, so clock skew between the two servers does not enter into it.
 */
@Component
public class FreshnessCorrelator {

    private static final Logger log = LoggerFactory.getLogger(FreshnessCorrelator.class);
    private static final String REFRESH_AGE_SQL = """
            SELECT EXTRACT(EPOCH FROM (NOW() - last_refresh)) AS age, refresh_duration
            FROM materialized_view_refresh_log
            WHERE view_name = ?
            """;
    private static final String BASELINE_HEARTBEAT_SQL =
            "SELECT id, ts, NOW() AS current_ts FROM heartbeats ORDER BY id DESC LIMIT 1";
    private static final String STREAMING_HEARTBEAT_SQL = "SELECT id, ts FROM %s.heartbeats ORDER BY ts DESC LIMIT 1";
    private static final String INDEX_EXISTS_SQL = "SELECT TRUE FROM mz_catalog.mz_indexes WHERE name = ?";

    private final ConnectionPoolManager poolManager;
    private final StatsStore statsStore;
    private final FreshnessLabProperties properties;

    public FreshnessCorrelator(ConnectionPoolManager poolManager,
                               StatsStore statsStore,
                               FreshnessLabProperties properties) {
        this.poolManager = poolManager;
        this.statsStore = statsStore;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${lab.freshness.freshness-interval-ms:1000}")
    public void tick() {
        try {
            updateCachedTableFreshness();
        } catch (SQLException | LabBackendException ex) {
            log.warn("Error reading refresh log message={}", ex.getMessage());
        }
        try {
            updateStreamingFreshness();
        } catch (SQLException | LabBackendException ex) {
            log.warn("Error reading baseline heartbeat message={}", ex.getMessage());
        }
    }

    public void updateCachedTableFreshness() throws SQLException {
        try (LabConnection connection = poolManager.acquire(BackendFamily.POSTGRES);
             PreparedStatement statement = connection.prepareStatement(REFRESH_AGE_SQL)) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            statement.setString(1, properties.getViewName());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (resultSet.next()) {
                    statsStore.recordCachedTableFreshness(
                            resultSet.getDouble("age"), resultSet.getDouble("refresh_duration"));
                }
            }
        }
    }

    /**
     * Computes the streaming lag and folds it into the stats. A streaming timeout or missing relation
     * marks the streaming backend unavailable instead of failing the tick.
     */
    public void updateStreamingFreshness() throws SQLException {
        BaselineHeartbeat baseline = fetchBaselineHeartbeat();
        if (!poolManager.isAvailable(BackendFamily.MATERIALIZE)) {
            return;
        }
        Heartbeat streaming;
        try {
            streaming = fetchStreamingHeartbeat();
        } catch (SQLException ex) {
            if (SqlStates.isTimeout(ex)) {
                log.warn("Timeout while fetching Materialize heartbeat timeoutSeconds={}",
                        properties.getCorrelationTimeoutSeconds());
            } else if (SqlStates.isUndefinedRelation(ex)) {
                log.warn("Materialize heartbeat relation not found message={}", ex.getMessage());
            } else {
                log.error("Error getting Materialize heartbeat message={}", ex.getMessage());
            }
            statsStore.markUnavailable(Backend.STREAMING);
            return;
        } catch (LabBackendException ex) {
            log.warn("Materialize connection unavailable message={}", ex.getMessage());
            statsStore.markUnavailable(Backend.STREAMING);
            return;
        }
        if (baseline == null || streaming == null) {
            return;
        }
        double lag = computeLagSeconds(baseline, streaming);
        statsStore.recordStreamingFreshness(lag);
        log.debug("Streaming lag baselineId={} streamingId={} lagSeconds={}",
                baseline.sequenceId(), streaming.sequenceId(), lag);
    }

    /**
     * Lag in seconds between the baseline and the streaming replica. Zero once the replica has seen
     * the latest baseline heartbeat; never negative.
     */
    public static double computeLagSeconds(BaselineHeartbeat baseline, Heartbeat streaming) {
        if (baseline.sequenceId() <= streaming.sequenceId()) {
            return 0.0;
        }
        Duration behind = Duration.between(streaming.timestamp(), baseline.timestamp());
        Duration sinceWrite = Duration.between(baseline.timestamp(), baseline.serverNow());
        double lag = behind.plus(sinceWrite).toNanos() / 1_000_000_000.0;
        return Math.max(0.0, lag);
    }

    /**
     * Whether the streaming readiness index exists. Retries on connection loss with exponential
     * backoff; any other failure, or no streaming pool, reads as absent.
     */
    public boolean isReadinessIndexPresent() {
        int maxAttempts = Math.max(1, properties.getReadinessMaxAttempts());
        long delay = properties.getReadinessRetryBackoffMs();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (!poolManager.isAvailable(BackendFamily.MATERIALIZE)) {
                return false;
            }
            try {
                return queryIndexExists();
            } catch (SQLException | LabBackendException ex) {
                if (!SqlStates.isConnectionLoss(ex)) {
                    log.error("Error checking Materialize index message={}", ex.getMessage());
                    return false;
                }
                log.warn("Connection lost during index check attempt={}/{}", attempt, maxAttempts);
                if (attempt < maxAttempts) {
                    if (!sleepBackoff(delay)) {
                        return false;
                    }
                    delay *= 2;
                }
            }
        }
        return false;
    }

    private boolean queryIndexExists() throws SQLException {
        try (LabConnection connection = poolManager.acquire(BackendFamily.MATERIALIZE);
             PreparedStatement statement = connection.prepareStatement(INDEX_EXISTS_SQL)) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            statement.setString(1, properties.getReadinessIndexName());
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() && resultSet.getBoolean(1);
            }
        }
    }

    private BaselineHeartbeat fetchBaselineHeartbeat() throws SQLException {
        try (LabConnection connection = poolManager.acquire(BackendFamily.POSTGRES);
             PreparedStatement statement = connection.prepareStatement(BASELINE_HEARTBEAT_SQL)) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                Heartbeat heartbeat = new Heartbeat(resultSet.getLong("id"),
                        resultSet.getObject("ts", OffsetDateTime.class).toInstant());
                return new BaselineHeartbeat(heartbeat,
                        resultSet.getObject("current_ts", OffsetDateTime.class).toInstant());
            }
        }
    }

    private Heartbeat fetchStreamingHeartbeat() throws SQLException {
        String sql = String.format(STREAMING_HEARTBEAT_SQL, properties.getStreaming().getSchema());
        try (LabConnection connection = poolManager.acquire(BackendFamily.MATERIALIZE);
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(properties.getCorrelationTimeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return null;
                }
                return new Heartbeat(resultSet.getLong("id"),
                        resultSet.getObject("ts", OffsetDateTime.class).toInstant());
            }
        }
    }

    private boolean sleepBackoff(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

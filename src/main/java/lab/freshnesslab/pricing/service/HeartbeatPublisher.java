package lab.freshnesslab.pricing.service;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicReference;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.domain.Heartbeat;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Writes one heartbeat per tick on the baseline and touches the tracked product in the same
 * transaction, so the streaming replica sees both changes together.
 */
@Component
public class HeartbeatPublisher {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatPublisher.class);
    private static final String INSERT_HEARTBEAT = "INSERT INTO heartbeats (ts) VALUES (NOW()) RETURNING id, ts";
    private static final String TOUCH_PRODUCT = "UPDATE products SET last_update_time = NOW() WHERE product_id = ?";

    private final ConnectionPoolManager poolManager;
    private final FreshnessLabProperties properties;
    private final AtomicReference<Heartbeat> latest = new AtomicReference<>();

    public HeartbeatPublisher(ConnectionPoolManager poolManager, FreshnessLabProperties properties) {
        this.poolManager = poolManager;
        this.properties = properties;
    }

    @Scheduled(fixedRateString = "${lab.freshness.heartbeat-interval-ms:1000}")
    public void tick() {
        try {
            publish();
        } catch (SQLException | LabBackendException ex) {
            log.error("Error creating heartbeat message={}", ex.getMessage());
        }
    }

    public Heartbeat publish() throws SQLException {
        try (LabConnection connection = poolManager.acquire(BackendFamily.POSTGRES)) {
            connection.setAutoCommit(false);
            try {
                Heartbeat heartbeat = insertHeartbeat(connection);
                try (PreparedStatement statement = connection.prepareStatement(TOUCH_PRODUCT)) {
                    statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
                    statement.setLong(1, properties.getProductId());
                    statement.executeUpdate();
                }
                connection.commit();
                latest.set(heartbeat);
                log.debug("Created heartbeat id={} ts={}", heartbeat.sequenceId(), heartbeat.timestamp());
                return heartbeat;
            } catch (SQLException | RuntimeException ex) {
                connection.rollbackAfterFailure();
                throw ex;
            }
        }
    }

    /**
     * Most recent committed heartbeat, or null before the first one.
     */
    public Heartbeat latest() {
        return latest.get();
    }

    private Heartbeat insertHeartbeat(LabConnection connection) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(INSERT_HEARTBEAT)) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    throw new SQLException("Heartbeat insert returned no row");
                }
                OffsetDateTime ts = resultSet.getObject("ts", OffsetDateTime.class);
                return new Heartbeat(resultSet.getLong("id"), ts.toInstant());
            }
        }
    }
}

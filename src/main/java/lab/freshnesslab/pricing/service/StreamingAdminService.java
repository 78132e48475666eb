package lab.freshnesslab.pricing.service;

import java.sql.SQLException;
import java.sql.Statement;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class StreamingAdminService {

    private static final Logger log = LoggerFactory.getLogger(StreamingAdminService.class);
    public static final String SERIALIZABLE = "serializable";
    public static final String STRICT_SERIALIZABLE = "strict serializable";

    private final ConnectionPoolManager poolManager;
    private final FreshnessCorrelator correlator;
    private final FreshnessLabProperties properties;

    public StreamingAdminService(ConnectionPoolManager poolManager,
                                 FreshnessCorrelator correlator,
                                 FreshnessLabProperties properties) {
        this.poolManager = poolManager;
        this.correlator = correlator;
        this.properties = properties;
    }

    /**
     * Drops the readiness index when present, creates it otherwise.
     *
     * @return whether the index exists afterwards
     */
    public boolean toggleReadinessIndex() {
        boolean present = correlator.isReadinessIndexPresent();
        String schema = properties.getStreaming().getSchema();
        String indexName = properties.getReadinessIndexName();
        String ddl = present
                ? "DROP INDEX " + schema + "." + indexName
                : "CREATE INDEX " + indexName + " ON " + schema + "." + Backend.STREAMING.relation()
                        + " (product_id)";
        try (LabConnection connection = poolManager.acquire(BackendFamily.MATERIALIZE);
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            statement.execute(ddl);
        } catch (SQLException ex) {
            throw new LabBackendException("Failed to toggle index: " + ex.getMessage(),
                    BackendFamily.MATERIALIZE, false, ex);
        }
        log.info("Readiness index toggled index={} exists={}", indexName, !present);
        return !present;
    }

    public boolean readinessIndexStatus() {
        return correlator.isReadinessIndexPresent();
    }

    /**
     * Flips the streaming isolation level. The streaming pool is rebuilt so every new session starts with it.
     */
    public String toggleIsolationLevel() {
        String next = SERIALIZABLE.equals(poolManager.isolationLevel()) ? STRICT_SERIALIZABLE : SERIALIZABLE;
        poolManager.setIsolationLevel(next);
        log.info("Streaming isolation level updated isolationLevel={}", next);
        return next;
    }
}

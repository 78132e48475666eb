package lab.freshnesslab.pricing.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.exception.ConnectionExhaustedException;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.exception.PoolInitializationException;
import lab.freshnesslab.pricing.exception.PoolUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Owns the PostgreSQL and Materialize pools. Other components only acquire and release.
 */
@Component
public class ConnectionPoolManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);
    private static final long DRAIN_POLL_MS = 100;

    private final DataSourceFactory dataSourceFactory;
    private final FreshnessLabProperties properties;
    private final ReentrantLock poolLock = new ReentrantLock();
    private final Map<BackendFamily, AtomicReference<HikariDataSource>> pools = new EnumMap<>(BackendFamily.class);
    private final AtomicLong rotationSequence = new AtomicLong();
    private final AtomicReference<String> isolationLevel;

    public ConnectionPoolManager(DataSourceFactory dataSourceFactory, FreshnessLabProperties properties) {
        this.dataSourceFactory = dataSourceFactory;
        this.properties = properties;
        this.isolationLevel = new AtomicReference<>(properties.getDefaultIsolationLevel());
        for (BackendFamily family : BackendFamily.values()) {
            pools.put(family, new AtomicReference<>());
        }
    }

    /**
     * Opens both pools. A PostgreSQL failure aborts startup; a Materialize failure leaves the
     * streaming backend absent until the next rotation manages to open it.
     */
    @PostConstruct
    public void initializePools() {
        poolLock.lock();
        try {
            if (pools.get(BackendFamily.POSTGRES).get() == null) {
                try {
                    pools.get(BackendFamily.POSTGRES).set(openPool(BackendFamily.POSTGRES));
                    log.info("PostgreSQL pool initialized host={}", properties.getBaseline().getHost());
                } catch (SQLException | RuntimeException ex) {
                    log.error("Failed to create PostgreSQL pool message={}", ex.getMessage(), ex);
                    throw new PoolInitializationException(BackendFamily.POSTGRES, ex);
                }
            }
            if (pools.get(BackendFamily.MATERIALIZE).get() == null) {
                try {
                    pools.get(BackendFamily.MATERIALIZE).set(openPool(BackendFamily.MATERIALIZE));
                    log.info("Materialize pool initialized host={}", properties.getStreaming().getHost());
                } catch (SQLException | RuntimeException ex) {
                    log.error("Materialize pool unavailable, continuing without streaming backend message={}",
                            ex.getMessage());
                }
            }
        } finally {
            poolLock.unlock();
        }
    }

    public boolean isAvailable(BackendFamily family) {
        HikariDataSource pool = pools.get(family).get();
        return pool != null && !pool.isClosed();
    }

    public LabConnection acquire(BackendFamily family) throws SQLException {
        int maxAttempts = Math.max(1, properties.getAcquireMaxAttempts());
        SQLException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            HikariDataSource pool = pools.get(family).get();
            if (pool == null) {
                throw new PoolUnavailableException(family);
            }
            try {
                return new LabConnection(pool.getConnection(), family);
            } catch (SQLException ex) {
                // A pool closed by a concurrent rotation behaves like an exhausted one: retry on the new pool.
                if (!SqlStates.isPoolExhausted(ex) && !pool.isClosed()) {
                    throw ex;
                }
                lastFailure = ex;
                if (attempt < maxAttempts) {
                    long delay = properties.getAcquireBackoffMs() * (1L << Math.min(attempt - 1, 6));
                    log.warn("{} pool exhausted, retrying in {}ms attempt={}/{}",
                            family.displayName(), delay, attempt, maxAttempts);
                    sleepBackoff(delay);
                }
            }
        }
        throw new ConnectionExhaustedException(family, maxAttempts, lastFailure);
    }

    public void release(LabConnection connection) {
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (RuntimeException ex) {
            log.warn("Error releasing {} connection message={}", connection.family().displayName(), ex.getMessage());
        }
    }

    /**
     * Replaces the Materialize pool wholesale. Its connections cannot rely on reset-on-release,
     * so long-lived sessions are recycled on a fixed cadence instead.
     */
    @Scheduled(fixedDelayString = "${lab.freshness.rotation-interval-ms:60000}",
            initialDelayString = "${lab.freshness.rotation-interval-ms:60000}")
    public void rotate() {
        replaceStreamingPool();
    }

    @PreDestroy
    public void shutdown() {
        poolLock.lock();
        try {
            for (BackendFamily family : BackendFamily.values()) {
                HikariDataSource pool = pools.get(family).getAndSet(null);
                if (pool != null) {
                    pool.close();
                    log.info("{} pool closed", family.displayName());
                }
            }
        } finally {
            poolLock.unlock();
        }
    }

    public String isolationLevel() {
        return isolationLevel.get();
    }

    /**
     * Session settings are applied once per physical connection, so a new level takes effect through
     * a rebuilt Materialize pool. When the rebuild fails the previous level stays in force.
     */
    public void setIsolationLevel(String level) {
        String previous = isolationLevel.getAndSet(level);
        if (level.equals(previous)) {
            return;
        }
        if (!replaceStreamingPool()) {
            isolationLevel.compareAndSet(level, previous);
            throw new LabBackendException("Failed to apply isolation level " + level,
                    BackendFamily.MATERIALIZE, true);
        }
    }

    private HikariDataSource openPool(BackendFamily family) throws SQLException {
        FreshnessLabProperties.BackendConnection settings = family == BackendFamily.POSTGRES
                ? properties.getBaseline()
                : properties.getStreaming();
        String poolName = settings.getApplicationName() + "-" + rotationSequence.incrementAndGet();
        HikariDataSource pool = dataSourceFactory.create(family, settings, poolName, isolationLevel.get());
        try (Connection connection = pool.getConnection();
             Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            statement.execute("SELECT 1");
        } catch (SQLException | RuntimeException ex) {
            pool.close();
            throw ex;
        }
        return pool;
    }

    private boolean replaceStreamingPool() {
        HikariDataSource previous;
        poolLock.lock();
        try {
            HikariDataSource fresh;
            try {
                fresh = openPool(BackendFamily.MATERIALIZE);
            } catch (SQLException | RuntimeException ex) {
                log.warn("Materialize pool rotation failed, keeping current pool message={}", ex.getMessage());
                return false;
            }
            previous = pools.get(BackendFamily.MATERIALIZE).getAndSet(fresh);
            log.info("Materialize pool rotated pool={} isolationLevel={}", fresh.getPoolName(), isolationLevel.get());
        } finally {
            poolLock.unlock();
        }
        drainAndClose(previous);
        return true;
    }

    private void drainAndClose(HikariDataSource previous) {
        if (previous == null) {
            return;
        }
        HikariPoolMXBean poolBean = previous.getHikariPoolMXBean();
        if (poolBean != null) {
            poolBean.softEvictConnections();
            long deadline = System.currentTimeMillis() + properties.getDrainTimeoutMs();
            while (poolBean.getActiveConnections() > 0 && System.currentTimeMillis() < deadline) {
                if (!sleepBackoff(DRAIN_POLL_MS)) {
                    break;
                }
            }
            if (poolBean.getActiveConnections() > 0) {
                log.warn("Closing {} with {} active connections after drain timeout",
                        previous.getPoolName(), poolBean.getActiveConnections());
            }
        }
        previous.close();
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

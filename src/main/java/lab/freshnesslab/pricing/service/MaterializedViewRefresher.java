package lab.freshnesslab.pricing.service;

import jakarta.annotation.PreDestroy;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.BackendFamily;
import lab.freshnesslab.pricing.exception.InvalidRefreshIntervalException;
import lab.freshnesslab.pricing.exception.LabBackendException;
import lab.freshnesslab.pricing.exception.RefreshFailedException;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import lab.freshnesslab.pricing.pool.LabConnection;
import lab.freshnesslab.pricing.stats.StatsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Fully refreshes the cached table on a cadence that can be changed at runtime.
 *
 * <p>Each loop cycle is tagged with a generation. Reconfiguring bumps the generation, cancels the
 * pending wait and starts a new cycle at once; a cycle of an older generation still finishes its
 * refresh but does not schedule a successor.
 */
@Component
public class MaterializedViewRefresher {

    private static final Logger log = LoggerFactory.getLogger(MaterializedViewRefresher.class);
    public static final int MIN_INTERVAL_SECONDS = 1;

    private static final String[] SESSION_LIMITS = {
            "SET LOCAL lock_timeout = '%ds'",
            "SET LOCAL statement_timeout = '%ds'",
            "SET LOCAL idle_in_transaction_session_timeout = '%ds'"
    };
    private static final String UPSERT_REFRESH_LOG = """
            INSERT INTO materialized_view_refresh_log (view_name, last_refresh, refresh_duration)
            VALUES (?, NOW(), ?)
            ON CONFLICT (view_name)
            DO UPDATE SET last_refresh = EXCLUDED.last_refresh, refresh_duration = EXCLUDED.refresh_duration
            """;

    private final ConnectionPoolManager poolManager;
    private final StatsStore statsStore;
    private final FreshnessLabProperties properties;
    private final TaskScheduler refreshScheduler;
    private final AtomicInteger intervalSeconds;
    private final AtomicLong generation = new AtomicLong();
    private final ReentrantLock scheduleLock = new ReentrantLock();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private volatile ScheduledFuture<?> pending;
    private volatile boolean running;

    public MaterializedViewRefresher(ConnectionPoolManager poolManager,
                                     StatsStore statsStore,
                                     FreshnessLabProperties properties,
                                     @Qualifier("refreshScheduler") TaskScheduler refreshScheduler) {
        this.poolManager = poolManager;
        this.statsStore = statsStore;
        this.properties = properties;
        this.refreshScheduler = refreshScheduler;
        this.intervalSeconds = new AtomicInteger(Math.max(MIN_INTERVAL_SECONDS, properties.getRefreshIntervalSeconds()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        scheduleLock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            scheduleCycle(generation.incrementAndGet(), 0L);
            log.info("Materialized view auto-refresh started intervalSeconds={}", intervalSeconds.get());
        } finally {
            scheduleLock.unlock();
        }
    }

    @PreDestroy
    public void stop() {
        scheduleLock.lock();
        try {
            running = false;
            generation.incrementAndGet();
            cancelPending();
        } finally {
            scheduleLock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public int getRefreshInterval() {
        return intervalSeconds.get();
    }

    /**
     * Changes the cadence and restarts the loop immediately. Values below one second are rejected
     * without touching the current interval.
     */
    public void setRefreshInterval(int seconds) {
        if (seconds < MIN_INTERVAL_SECONDS) {
            throw new InvalidRefreshIntervalException(seconds, MIN_INTERVAL_SECONDS);
        }
        scheduleLock.lock();
        try {
            int previous = intervalSeconds.getAndSet(seconds);
            long next = generation.incrementAndGet();
            cancelPending();
            if (running) {
                scheduleCycle(next, 0L);
            }
            log.info("Refresh interval updated previousSeconds={} intervalSeconds={}", previous, seconds);
        } finally {
            scheduleLock.unlock();
        }
    }

    /**
     * Refreshes the cached table once and logs the run. Concurrent callers are serialized.
     *
     * @return wall-clock duration of the refresh statement
     */
    public Duration refreshOnce() {
        refreshLock.lock();
        try (LabConnection connection = poolManager.acquire(BackendFamily.POSTGRES)) {
            connection.setAutoCommit(false);
            try {
                applySessionLimits(connection);
                long startedNs = System.nanoTime();
                try (Statement statement = connection.createStatement()) {
                    statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
                    statement.execute("REFRESH MATERIALIZED VIEW " + properties.getViewName());
                }
                Duration duration = Duration.ofNanos(System.nanoTime() - startedNs);
                try (PreparedStatement statement = connection.prepareStatement(UPSERT_REFRESH_LOG)) {
                    statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
                    statement.setString(1, properties.getViewName());
                    statement.setDouble(2, duration.toNanos() / 1_000_000_000.0);
                    statement.executeUpdate();
                }
                connection.commit();
                statsStore.recordRefreshDuration(duration);
                log.debug("Materialized view refresh completed view={} durationMs={}",
                        properties.getViewName(), duration.toMillis());
                return duration;
            } catch (SQLException | RuntimeException ex) {
                connection.rollbackAfterFailure();
                throw ex;
            }
        } catch (SQLException ex) {
            throw new RefreshFailedException(properties.getViewName(), ex);
        } finally {
            refreshLock.unlock();
        }
    }

    void runCycle(long cycleGeneration) {
        if (!isCurrent(cycleGeneration)) {
            return;
        }
        long startedNs = System.nanoTime();
        int maxAttempts = Math.max(1, properties.getRefreshMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                refreshOnce();
                break;
            } catch (LabBackendException ex) {
                if (attempt == maxAttempts) {
                    log.error("Materialized view refresh failed after {} attempts message={}",
                            maxAttempts, ex.getMessage());
                } else {
                    log.warn("Refresh attempt {} failed, retrying message={}", attempt, ex.getMessage());
                    if (!sleepBackoff(properties.getRefreshRetryBackoffMs())) {
                        return;
                    }
                }
            } catch (RuntimeException ex) {
                log.error("Unexpected error in auto refresh message={}", ex.getMessage(), ex);
                break;
            }
        }
        long elapsedMs = Duration.ofNanos(System.nanoTime() - startedNs).toMillis();
        long waitMs = Math.max(0L, intervalSeconds.get() * 1000L - elapsedMs);
        log.debug("Refresh cycle done, next in {}ms intervalSeconds={}", waitMs, intervalSeconds.get());
        scheduleLock.lock();
        try {
            if (isCurrent(cycleGeneration)) {
                scheduleCycle(cycleGeneration, waitMs);
            }
        } finally {
            scheduleLock.unlock();
        }
    }

    private boolean isCurrent(long cycleGeneration) {
        return running && cycleGeneration == generation.get();
    }

    // Caller holds scheduleLock.
    private void scheduleCycle(long cycleGeneration, long delayMs) {
        pending = refreshScheduler.schedule(() -> runCycle(cycleGeneration), Instant.now().plusMillis(delayMs));
    }

    private void cancelPending() {
        ScheduledFuture<?> current = pending;
        if (current != null) {
            current.cancel(false);
            pending = null;
        }
    }

    private void applySessionLimits(LabConnection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.setQueryTimeout(properties.getStatementTimeoutSeconds());
            for (String template : SESSION_LIMITS) {
                statement.execute(String.format(template, properties.getStatementTimeoutSeconds()));
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

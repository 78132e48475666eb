package lab.freshnesslab.pricing.stats;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendSnapshot;
import lab.freshnesslab.pricing.domain.PriceRow;
import lab.freshnesslab.pricing.domain.WindowStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Per-backend rolling statistics. Every mutation happens under a single lock.
 */
@Component
public class StatsStore {

    private static final Logger log = LoggerFactory.getLogger(StatsStore.class);
    private static final int PERCENTILE_MIN_SAMPLES = 100;
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final Clock clock;
    private final Duration qpsHorizon;
    private final Duration stalenessThreshold;
    private final int windowSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Backend, BackendStats> stats = new EnumMap<>(Backend.class);
    private final RollingWindow refreshDurations;

    public StatsStore(Clock clock, FreshnessLabProperties properties) {
        this.clock = clock;
        this.qpsHorizon = Duration.ofMillis(properties.getQpsWindowMs());
        this.stalenessThreshold = Duration.ofMillis(properties.getStalenessThresholdMs());
        this.windowSize = properties.getLatencyWindowSize();
        this.refreshDurations = RollingWindow.ofSize(windowSize);
        for (Backend backend : Backend.values()) {
            stats.put(backend, new BackendStats(qpsHorizon, windowSize));
        }
    }

    public void recordObservation(Backend backend, Duration duration, PriceRow row) {
        lock.lock();
        try {
            Instant now = clock.instant();
            BackendStats current = stats.get(backend);
            double latencyMs = duration.toNanos() / NANOS_PER_MILLI;

            current.counts.add(1.0, now);
            current.latencies.add(latencyMs, now);

            if (row != null && row.lastUpdateTime() != null) {
                double endToEndMs = Duration.between(row.lastUpdateTime(), now).toNanos() / NANOS_PER_MILLI;
                current.endToEndLatencies.add(endToEndMs, now);
                current.endToEndLatencyMs = endToEndMs;
            }

            current.qps = computeQps(current.counts);
            current.latencyMs = latencyMs;

            if (row != null && row.adjustedPrice() != null) {
                current.price = row.adjustedPrice();
            } else {
                log.debug("No valid price update backend={}", backend.displayName());
            }

            if (current.lastUpdated == null || now.isAfter(current.lastUpdated)) {
                current.lastUpdated = now;
            }
        } finally {
            lock.unlock();
        }
    }

    public void recordRefreshDuration(Duration duration) {
        lock.lock();
        try {
            double seconds = duration.toNanos() / 1_000_000_000.0;
            refreshDurations.add(seconds, clock.instant());
            stats.get(Backend.CACHED_TABLE).refreshDurationSeconds = seconds;
            log.debug("Stored refresh duration seconds={} samples={}", seconds, refreshDurations.size());
        } finally {
            lock.unlock();
        }
    }

    public void recordCachedTableFreshness(double ageSeconds, double refreshDurationSeconds) {
        lock.lock();
        try {
            BackendStats current = stats.get(Backend.CACHED_TABLE);
            current.freshnessSeconds = ageSeconds;
            current.refreshDurationSeconds = refreshDurationSeconds;
        } finally {
            lock.unlock();
        }
    }

    public void recordStreamingFreshness(double lagSeconds) {
        lock.lock();
        try {
            stats.get(Backend.STREAMING).freshnessSeconds = lagSeconds;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the published fields of a backend so readers see them as unavailable rather than stale.
     */
    public void markUnavailable(Backend backend) {
        lock.lock();
        try {
            BackendStats current = stats.get(backend);
            current.qps = null;
            current.latencyMs = null;
            current.endToEndLatencyMs = null;
            current.price = null;
            current.freshnessSeconds = null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Published values for a backend, or an all-null snapshot when nothing was recorded within the
     * staleness threshold.
     */
    public BackendSnapshot snapshot(Backend backend) {
        lock.lock();
        try {
            BackendStats current = stats.get(backend);
            Instant now = clock.instant();
            if (current.lastUpdated == null
                    || Duration.between(current.lastUpdated, now).compareTo(stalenessThreshold) > 0) {
                return BackendSnapshot.unavailable();
            }
            WindowStats refreshStats = null;
            if (backend == Backend.CACHED_TABLE && !refreshDurations.isEmpty()) {
                refreshStats = computeStats(refreshDurations.values());
            }
            return new BackendSnapshot(
                    current.qps,
                    current.latencyMs,
                    current.endToEndLatencyMs,
                    current.price,
                    current.freshnessSeconds,
                    current.refreshDurationSeconds,
                    computeStats(current.latencies.values()),
                    computeStats(current.endToEndLatencies.values()),
                    refreshStats);
        } finally {
            lock.unlock();
        }
    }

    public Instant lastUpdated(Backend backend) {
        lock.lock();
        try {
            return stats.get(backend).lastUpdated;
        } finally {
            lock.unlock();
        }
    }

    public int latencySampleCount(Backend backend) {
        lock.lock();
        try {
            return stats.get(backend).latencies.size();
        } finally {
            lock.unlock();
        }
    }

    public int qpsSampleCount(Backend backend) {
        lock.lock();
        try {
            return stats.get(backend).counts.size();
        } finally {
            lock.unlock();
        }
    }

    public void reset() {
        lock.lock();
        try {
            for (Backend backend : Backend.values()) {
                stats.put(backend, new BackendStats(qpsHorizon, windowSize));
            }
            refreshDurations.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Max, mean and 99th percentile of a window. Below 100 samples the percentile is reported as the
     * maximum; from 100 samples on it is the nearest-rank 99th percentile.
     */
    public static WindowStats computeStats(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return WindowStats.EMPTY;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        double max = sorted.get(sorted.size() - 1);
        double total = 0.0;
        for (double value : sorted) {
            total += value;
        }
        double p99 = max;
        if (sorted.size() >= PERCENTILE_MIN_SAMPLES) {
            int rank = (int) Math.ceil(0.99 * sorted.size());
            p99 = sorted.get(Math.max(0, rank - 1));
        }
        return new WindowStats(max, total / sorted.size(), p99);
    }

    private double computeQps(RollingWindow counts) {
        if (counts.isEmpty()) {
            return 0.0;
        }
        double spanSeconds = counts.span().toNanos() / 1_000_000_000.0;
        double windowSeconds = qpsHorizon.toNanos() / 1_000_000_000.0;
        return counts.sum() / Math.max(windowSeconds, spanSeconds);
    }

    private static final class BackendStats {
        private final RollingWindow counts;
        private final RollingWindow latencies;
        private final RollingWindow endToEndLatencies;
        private Double qps = 0.0;
        private Double latencyMs = 0.0;
        private Double endToEndLatencyMs = 0.0;
        private BigDecimal price;
        private Double freshnessSeconds;
        private Double refreshDurationSeconds;
        private Instant lastUpdated;

        private BackendStats(Duration qpsHorizon, int windowSize) {
            this.counts = RollingWindow.ofHorizon(qpsHorizon);
            this.latencies = RollingWindow.ofSize(windowSize);
            this.endToEndLatencies = RollingWindow.ofSize(windowSize);
        }
    }
}

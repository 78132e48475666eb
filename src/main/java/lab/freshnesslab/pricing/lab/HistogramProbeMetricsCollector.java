package lab.freshnesslab.pricing.lab;

import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import lab.freshnesslab.pricing.domain.Backend;
import org.HdrHistogram.ConcurrentHistogram;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "lab.enabled", havingValue = "true")
public class HistogramProbeMetricsCollector implements ProbeMetricsCollector {

    // Probe queries carry a 120s timeout; anything above that is clamped.
    private static final long HIGHEST_TRACKABLE_NS = TimeUnit.MINUTES.toNanos(5);
    private static final int SIGNIFICANT_DIGITS = 3;

    private final Clock clock;
    private final Map<Backend, BackendCounters> counters = new EnumMap<>(Backend.class);
    private final AtomicLong startedAtMs = new AtomicLong();

    public HistogramProbeMetricsCollector(Clock clock) {
        this.clock = clock;
        for (Backend backend : Backend.values()) {
            counters.put(backend, new BackendCounters());
        }
        startedAtMs.set(clock.millis());
    }

    @Override
    public void reset() {
        for (BackendCounters backendCounters : counters.values()) {
            backendCounters.reset();
        }
        startedAtMs.set(clock.millis());
    }

    @Override
    public void recordSuccess(Backend backend, long durationNs) {
        BackendCounters backendCounters = counters.get(backend);
        backendCounters.recordDuration(durationNs);
        backendCounters.successCount.increment();
    }

    @Override
    public void recordFail(Backend backend, long durationNs) {
        BackendCounters backendCounters = counters.get(backend);
        backendCounters.recordDuration(durationNs);
        backendCounters.failCount.increment();
    }

    @Override
    public ProbeMetricsSnapshot metricsSnapshot() {
        Map<String, BackendProbeSnapshot> backends = new LinkedHashMap<>();
        for (Backend backend : Backend.values()) {
            backends.put(backend.statsKey(), counters.get(backend).snapshot());
        }
        return new ProbeMetricsSnapshot(startedAtMs.get(), backends);
    }

    private static final class BackendCounters {
        private final ConcurrentHistogram durationHistogram =
                new ConcurrentHistogram(HIGHEST_TRACKABLE_NS, SIGNIFICANT_DIGITS);
        private final LongAdder successCount = new LongAdder();
        private final LongAdder failCount = new LongAdder();

        private void recordDuration(long durationNs) {
            if (durationNs <= 0L) {
                return;
            }
            durationHistogram.recordValue(Math.min(durationNs, HIGHEST_TRACKABLE_NS));
        }

        private void reset() {
            successCount.reset();
            failCount.reset();
            synchronized (durationHistogram) {
                durationHistogram.reset();
            }
        }

        private BackendProbeSnapshot snapshot() {
            ConcurrentHistogram copy;
            synchronized (durationHistogram) {
                copy = durationHistogram.copy();
            }
            long count = copy.getTotalCount();
            ProbeLatencyStats latency = count == 0
                    ? ProbeLatencyStats.EMPTY
                    : new ProbeLatencyStats(count,
                            copy.getMinValue(),
                            copy.getMaxValue(),
                            copy.getMean(),
                            copy.getValueAtPercentile(95.0),
                            copy.getValueAtPercentile(99.0));
            return new BackendProbeSnapshot(latency, successCount.sum(), failCount.sum());
        }
    }
}

package lab.freshnesslab.pricing.service;

import jakarta.annotation.PreDestroy;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps a population of probe workers per backend, sized by the current concurrency limit.
 *
 * <p>The supervisor only ever adds workers. Workers retire themselves when the active count exceeds
 * the limit, so lowering a limit takes effect at the next probe boundary.
 */
@Component
public class LoadGenerator {

    private static final Logger log = LoggerFactory.getLogger(LoadGenerator.class);

    private final ProbeExecutor probeExecutor;
    private final FreshnessCorrelator correlator;
    private final ConnectionPoolManager poolManager;
    private final FreshnessLabProperties properties;
    private final TaskExecutor executor;
    private final Map<Backend, AtomicInteger> active = new EnumMap<>(Backend.class);
    private final Map<Backend, AtomicBoolean> trafficEnabled = new EnumMap<>(Backend.class);
    private final AtomicReference<Map<Backend, Integer>> limits = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public LoadGenerator(ProbeExecutor probeExecutor,
                         FreshnessCorrelator correlator,
                         ConnectionPoolManager poolManager,
                         FreshnessLabProperties properties,
                         @Qualifier("probeTaskExecutor") TaskExecutor executor) {
        this.probeExecutor = probeExecutor;
        this.correlator = correlator;
        this.poolManager = poolManager;
        this.properties = properties;
        this.executor = executor;
        for (Backend backend : Backend.values()) {
            active.put(backend, new AtomicInteger());
            trafficEnabled.put(backend, new AtomicBoolean(true));
        }
        limits.set(computeLimits(false));
    }

    @Scheduled(fixedDelayString = "${lab.freshness.supervisor-tick-ms:500}")
    public void supervise() {
        if (!running.get()) {
            return;
        }
        try {
            Map<Backend, Integer> current = computeLimits(correlator.isReadinessIndexPresent());
            limits.set(current);
            for (Backend backend : Backend.values()) {
                if (trafficEnabled.get(backend).get() && poolManager.isAvailable(backend.family())) {
                    topUp(backend, current.get(backend));
                }
            }
        } catch (RuntimeException ex) {
            log.error("Error in load supervisor message={}", ex.getMessage(), ex);
        }
    }

    public Map<Backend, Integer> computeLimits(boolean readinessIndexPresent) {
        int floor = Math.max(1, properties.getFloorConcurrency());
        Map<Backend, Integer> computed = new EnumMap<>(Backend.class);
        computed.put(Backend.BASELINE, floor);
        computed.put(Backend.CACHED_TABLE, floor);
        computed.put(Backend.STREAMING,
                readinessIndexPresent ? Math.max(floor, properties.getIndexedConcurrency()) : floor);
        return Collections.unmodifiableMap(computed);
    }

    public void setTrafficEnabled(Backend backend, boolean enabled) {
        boolean previous = trafficEnabled.get(backend).getAndSet(enabled);
        if (previous != enabled) {
            log.info("Traffic toggled backend={} enabled={}", backend.displayName(), enabled);
        }
    }

    public boolean isTrafficEnabled(Backend backend) {
        return trafficEnabled.get(backend).get();
    }

    public int activeWorkers(Backend backend) {
        return active.get(backend).get();
    }

    public Map<Backend, Integer> currentLimits() {
        return limits.get();
    }

    @PreDestroy
    public void stop() {
        running.set(false);
    }

    private void topUp(Backend backend, int limit) {
        AtomicInteger counter = active.get(backend);
        while (true) {
            int current = counter.get();
            if (current >= limit) {
                return;
            }
            if (!counter.compareAndSet(current, current + 1)) {
                continue;
            }
            try {
                executor.execute(() -> workerLoop(backend));
                log.debug("Started probe worker backend={} active={} limit={}", backend.displayName(), current + 1, limit);
            } catch (TaskRejectedException ex) {
                counter.decrementAndGet();
                log.warn("Probe worker rejected backend={} message={}", backend.displayName(), ex.getMessage());
                return;
            }
        }
    }

    private void workerLoop(Backend backend) {
        AtomicInteger counter = active.get(backend);
        boolean retired = false;
        try {
            while (running.get() && trafficEnabled.get(backend).get()) {
                if (tryRetire(counter, limits.get().get(backend))) {
                    retired = true;
                    return;
                }
                try {
                    probeExecutor.probe(backend);
                } catch (RuntimeException ex) {
                    log.warn("Probe worker error backend={} message={}", backend.displayName(), ex.getMessage());
                }
                if (!pause(properties.getProbeDelayMs())) {
                    return;
                }
            }
        } finally {
            if (!retired) {
                counter.decrementAndGet();
            }
        }
    }

    private boolean tryRetire(AtomicInteger counter, int limit) {
        while (true) {
            int current = counter.get();
            if (current <= limit) {
                return false;
            }
            if (counter.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    private boolean pause(long millis) {
        if (millis <= 0L) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}

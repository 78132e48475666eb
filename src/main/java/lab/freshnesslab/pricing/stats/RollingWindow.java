package lab.freshnesslab.pricing.stats;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Time-ordered samples bounded either by count or by age. Evicts from the head.
 *
 * <p>Not thread-safe; {@link StatsStore} guards every instance with its lock.
 */
public final class RollingWindow {

    private final Deque<Sample> samples = new ArrayDeque<>();
    private final int maxSize;
    private final Duration horizon;

    private RollingWindow(int maxSize, Duration horizon) {
        this.maxSize = maxSize;
        this.horizon = horizon;
    }

    public static RollingWindow ofSize(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        return new RollingWindow(maxSize, null);
    }

    public static RollingWindow ofHorizon(Duration horizon) {
        if (horizon == null || horizon.isNegative() || horizon.isZero()) {
            throw new IllegalArgumentException("horizon must be positive: " + horizon);
        }
        return new RollingWindow(Integer.MAX_VALUE, horizon);
    }

    /**
     * Appends a sample. A timestamp older than the newest sample is clamped so the window stays ascending.
     */
    public void add(double value, Instant timestamp) {
        Instant effective = timestamp;
        Sample newest = samples.peekLast();
        if (newest != null && timestamp.isBefore(newest.timestamp())) {
            effective = newest.timestamp();
        }
        samples.addLast(new Sample(value, effective));
        while (samples.size() > maxSize) {
            samples.pollFirst();
        }
        evictExpired(effective);
    }

    /**
     * Drops samples at or before {@code now - horizon}. No-op for count-bounded windows.
     */
    public void evictExpired(Instant now) {
        if (horizon == null) {
            return;
        }
        Instant cutoff = now.minus(horizon);
        while (!samples.isEmpty() && !samples.peekFirst().timestamp().isAfter(cutoff)) {
            samples.pollFirst();
        }
    }

    public int size() {
        return samples.size();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public double sum() {
        double total = 0.0;
        for (Sample sample : samples) {
            total += sample.value();
        }
        return total;
    }

    /**
     * Time between the oldest and newest sample; zero when fewer than two samples.
     */
    public Duration span() {
        if (samples.size() < 2) {
            return Duration.ZERO;
        }
        return Duration.between(samples.peekFirst().timestamp(), samples.peekLast().timestamp());
    }

    public List<Double> values() {
        List<Double> values = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            values.add(sample.value());
        }
        return values;
    }

    public List<Instant> timestamps() {
        List<Instant> timestamps = new ArrayList<>(samples.size());
        for (Sample sample : samples) {
            timestamps.add(sample.timestamp());
        }
        return timestamps;
    }

    public void clear() {
        samples.clear();
    }

    private record Sample(double value, Instant timestamp) {
    }
}

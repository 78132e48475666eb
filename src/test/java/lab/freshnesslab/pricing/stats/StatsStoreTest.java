package lab.freshnesslab.pricing.stats;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.domain.BackendSnapshot;
import lab.freshnesslab.pricing.domain.PriceRow;
import lab.freshnesslab.pricing.domain.WindowStats;
import lab.freshnesslab.pricing.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatsStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private StatsStore statsStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        statsStore = new StatsStore(clock, new FreshnessLabProperties());
    }

    @Test
    @DisplayName("One probe per second reports a QPS of 1.0")
    void qpsForOneEventPerSecond() {
        for (int i = 0; i < 5; i++) {
            statsStore.recordObservation(Backend.BASELINE, Duration.ofMillis(10), row("1.00"));
            clock.advance(Duration.ofSeconds(1));
        }
        clock.advance(Duration.ofSeconds(-1));

        BackendSnapshot snapshot = statsStore.snapshot(Backend.BASELINE);

        assertEquals(1, statsStore.qpsSampleCount(Backend.BASELINE));
        assertEquals(1.0, snapshot.qps(), 1e-9);
    }

    @Test
    void qpsWithinOneSecondDividesByOneSecond() {
        for (int i = 0; i < 4; i++) {
            statsStore.recordObservation(Backend.BASELINE, Duration.ofMillis(10), row("1.00"));
            clock.advance(Duration.ofMillis(100));
        }

        assertEquals(4.0, statsStore.snapshot(Backend.BASELINE).qps(), 1e-9);
    }

    @Test
    @DisplayName("Latency window never exceeds 100 entries")
    void latencyWindowIsBounded() {
        for (int i = 0; i < 250; i++) {
            statsStore.recordObservation(Backend.STREAMING, Duration.ofMillis(i), row("1.00"));
        }

        assertEquals(100, statsStore.latencySampleCount(Backend.STREAMING));
        assertEquals(249.0, statsStore.snapshot(Backend.STREAMING).latencyStats().max(), 1e-9);
    }

    @Test
    @DisplayName("Price is retained when a later probe has no price")
    void priceIsSticky() {
        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(5), row("42.50"));
        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(5), null);

        BackendSnapshot snapshot = statsStore.snapshot(Backend.CACHED_TABLE);

        assertEquals(new BigDecimal("42.50"), snapshot.price());
        assertEquals(5.0, snapshot.latencyMs(), 1e-9);
    }

    @Test
    @DisplayName("End-to-end latency is measured from the row's update time")
    void endToEndLatencyFromRowTimestamp() {
        PriceRow row = new PriceRow(1L, new BigDecimal("10.00"), T0.minusMillis(750));

        statsStore.recordObservation(Backend.STREAMING, Duration.ofMillis(3), row);

        assertEquals(750.0, statsStore.snapshot(Backend.STREAMING).endToEndLatencyMs(), 1e-9);
    }

    @Test
    @DisplayName("Snapshot is gated after 2s without observations")
    void snapshotGatedWhenStale() {
        statsStore.recordObservation(Backend.BASELINE, Duration.ofMillis(10), row("1.00"));

        clock.advance(Duration.ofSeconds(2));
        assertNotNull(statsStore.snapshot(Backend.BASELINE).qps());

        clock.advance(Duration.ofSeconds(1));
        assertEquals(BackendSnapshot.unavailable(), statsStore.snapshot(Backend.BASELINE));
    }

    @Test
    void neverObservedBackendIsUnavailable() {
        assertEquals(BackendSnapshot.unavailable(), statsStore.snapshot(Backend.STREAMING));
        assertNull(statsStore.lastUpdated(Backend.STREAMING));
    }

    @Test
    @DisplayName("markUnavailable clears published values but keeps the backend fresh")
    void markUnavailableClearsFields() {
        statsStore.recordObservation(Backend.STREAMING, Duration.ofMillis(10), row("9.99"));
        statsStore.recordStreamingFreshness(1.5);

        statsStore.markUnavailable(Backend.STREAMING);
        BackendSnapshot snapshot = statsStore.snapshot(Backend.STREAMING);

        assertNull(snapshot.qps());
        assertNull(snapshot.latencyMs());
        assertNull(snapshot.endToEndLatencyMs());
        assertNull(snapshot.price());
        assertNull(snapshot.freshnessSeconds());
    }

    @Test
    void freshnessUpdatesDoNotTouchLastUpdated() {
        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(10), row("1.00"));
        Instant observed = statsStore.lastUpdated(Backend.CACHED_TABLE);

        clock.advance(Duration.ofSeconds(1));
        statsStore.recordCachedTableFreshness(12.0, 0.4);

        assertEquals(observed, statsStore.lastUpdated(Backend.CACHED_TABLE));
        BackendSnapshot snapshot = statsStore.snapshot(Backend.CACHED_TABLE);
        assertEquals(12.0, snapshot.freshnessSeconds(), 1e-9);
        assertEquals(0.4, snapshot.refreshDurationSeconds(), 1e-9);
    }

    @Test
    void refreshDurationsFeedRefreshStats() {
        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(10), row("1.00"));
        statsStore.recordRefreshDuration(Duration.ofMillis(500));
        statsStore.recordRefreshDuration(Duration.ofMillis(1500));

        WindowStats refreshStats = statsStore.snapshot(Backend.CACHED_TABLE).refreshStats();

        assertEquals(1.5, refreshStats.max(), 1e-9);
        assertEquals(1.0, refreshStats.average(), 1e-9);
        assertNull(statsStore.snapshot(Backend.BASELINE).refreshStats());
    }

    @Test
    @DisplayName("p99 equals max below 100 samples")
    void p99IsMaxForSmallWindows() {
        WindowStats stats = StatsStore.computeStats(List.of(3.0, 1.0, 7.0, 5.0));

        assertEquals(7.0, stats.max());
        assertEquals(4.0, stats.average(), 1e-9);
        assertEquals(7.0, stats.p99());
    }

    @Test
    @DisplayName("p99 of 1..100 is 99")
    void p99NearestRank() {
        List<Double> values = new ArrayList<>();
        for (int i = 100; i >= 1; i--) {
            values.add((double) i);
        }

        WindowStats stats = StatsStore.computeStats(values);

        assertEquals(100.0, stats.max());
        assertEquals(50.5, stats.average(), 1e-9);
        assertEquals(99.0, stats.p99());
    }

    @Test
    void emptyStatsAreZero() {
        assertEquals(WindowStats.EMPTY, StatsStore.computeStats(List.of()));
    }

    @Test
    @DisplayName("Reset drops every window and published value")
    void resetClearsEverything() {
        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(10), row("3.00"));
        statsStore.recordRefreshDuration(Duration.ofSeconds(2));

        statsStore.reset();

        assertNull(statsStore.lastUpdated(Backend.CACHED_TABLE));
        assertEquals(0, statsStore.latencySampleCount(Backend.CACHED_TABLE));
        assertEquals(0, statsStore.qpsSampleCount(Backend.CACHED_TABLE));
        assertEquals(BackendSnapshot.unavailable(), statsStore.snapshot(Backend.CACHED_TABLE));

        statsStore.recordObservation(Backend.CACHED_TABLE, Duration.ofMillis(10), null);

        BackendSnapshot snapshot = statsStore.snapshot(Backend.CACHED_TABLE);
        assertNull(snapshot.price());
        assertNull(snapshot.refreshStats());
    }

    private static PriceRow row(String price) {
        return new PriceRow(1L, new BigDecimal(price), null);
    }
}

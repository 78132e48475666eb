package lab.freshnesslab.pricing.service;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import lab.freshnesslab.pricing.config.FreshnessLabProperties;
import lab.freshnesslab.pricing.domain.Backend;
import lab.freshnesslab.pricing.pool.ConnectionPoolManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class LoadGeneratorTest {

    @Mock
    private ProbeExecutor probeExecutor;

    @Mock
    private FreshnessCorrelator correlator;

    @Mock
    private ConnectionPoolManager poolManager;

    private ThreadPoolTaskExecutor executor;
    private LoadGenerator loadGenerator;
    private final CountDownLatch release = new CountDownLatch(1);

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("test-probe-");
        executor.initialize();

        FreshnessLabProperties properties = new FreshnessLabProperties();
        properties.setProbeDelayMs(1);
        loadGenerator = new LoadGenerator(probeExecutor, correlator, poolManager, properties, executor);
        when(poolManager.isAvailable(any())).thenReturn(true);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        loadGenerator.stop();
        executor.shutdown();
    }

    @Test
    @DisplayName("Supervisor never starts more workers than the limit")
    void respectsFloorLimit() {
        blockProbes();
        when(correlator.isReadinessIndexPresent()).thenReturn(false);

        loadGenerator.supervise();
        loadGenerator.supervise();
        loadGenerator.supervise();

        for (Backend backend : Backend.values()) {
            assertEquals(1, loadGenerator.activeWorkers(backend));
            assertEquals(1, loadGenerator.currentLimits().get(backend));
        }
        verify(probeExecutor, timeout(2000).times(1)).probe(Backend.STREAMING);
    }

    @Test
    @DisplayName("Readiness index raises the streaming limit only")
    void indexRaisesStreamingLimit() {
        blockProbes();
        when(correlator.isReadinessIndexPresent()).thenReturn(true);

        loadGenerator.supervise();

        assertEquals(2, loadGenerator.activeWorkers(Backend.STREAMING));
        assertEquals(1, loadGenerator.activeWorkers(Backend.BASELINE));
        assertEquals(1, loadGenerator.activeWorkers(Backend.CACHED_TABLE));
    }

    @Test
    @DisplayName("Disabled traffic starts no workers for that backend")
    void disabledTrafficStartsNone() {
        blockProbes();
        when(correlator.isReadinessIndexPresent()).thenReturn(false);
        loadGenerator.setTrafficEnabled(Backend.BASELINE, false);

        loadGenerator.supervise();

        assertFalse(loadGenerator.isTrafficEnabled(Backend.BASELINE));
        assertEquals(0, loadGenerator.activeWorkers(Backend.BASELINE));
        assertEquals(1, loadGenerator.activeWorkers(Backend.STREAMING));
        verify(probeExecutor, after(200).never()).probe(Backend.BASELINE);
    }

    @Test
    void unavailablePoolStartsNone() {
        when(correlator.isReadinessIndexPresent()).thenReturn(false);
        when(poolManager.isAvailable(any())).thenReturn(false);

        loadGenerator.supervise();

        for (Backend backend : Backend.values()) {
            assertEquals(0, loadGenerator.activeWorkers(backend));
        }
    }

    @Test
    @DisplayName("Workers retire when the limit drops")
    void workersRetireWhenLimitDrops() throws InterruptedException {
        when(correlator.isReadinessIndexPresent()).thenReturn(true);
        loadGenerator.supervise();
        assertEquals(2, loadGenerator.activeWorkers(Backend.STREAMING));

        when(correlator.isReadinessIndexPresent()).thenReturn(false);
        loadGenerator.supervise();

        assertTrue(awaitCondition(() -> loadGenerator.activeWorkers(Backend.STREAMING) == 1));
    }

    @Test
    void disablingTrafficDrainsWorkers() throws InterruptedException {
        when(correlator.isReadinessIndexPresent()).thenReturn(false);
        loadGenerator.supervise();

        loadGenerator.setTrafficEnabled(Backend.CACHED_TABLE, false);

        assertTrue(awaitCondition(() -> loadGenerator.activeWorkers(Backend.CACHED_TABLE) == 0));
    }

    @Test
    void supervisorSurvivesReadinessFailure() {
        when(correlator.isReadinessIndexPresent()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> loadGenerator.supervise());
    }

    private void blockProbes() {
        when(probeExecutor.probe(any())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return null;
        });
    }

    private boolean awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2000;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}

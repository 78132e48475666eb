package lab.freshnesslab.pricing.lab;

import java.util.Collections;
import lab.freshnesslab.pricing.domain.Backend;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnMissingBean(ProbeMetricsCollector.class)
public class NoopProbeMetricsCollector implements ProbeMetricsCollector {

    private static final ProbeMetricsSnapshot EMPTY_METRICS = new ProbeMetricsSnapshot(0L, Collections.emptyMap());

    @Override
    public void reset() {
    }

    @Override
    public void recordSuccess(Backend backend, long durationNs) {
    }

    @Override
    public void recordFail(Backend backend, long durationNs) {
    }

    @Override
    public ProbeMetricsSnapshot metricsSnapshot() {
        return EMPTY_METRICS;
    }
}

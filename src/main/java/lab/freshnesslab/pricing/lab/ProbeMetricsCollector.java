package lab.freshnesslab.pricing.lab;

import lab.freshnesslab.pricing.domain.Backend;

/**
 * Lifetime probe accounting, independent of the rolling windows published in snapshots.
 */
public interface ProbeMetricsCollector {

    void reset();

    void recordSuccess(Backend backend, long durationNs);

    void recordFail(Backend backend, long durationNs);

    ProbeMetricsSnapshot metricsSnapshot();
}

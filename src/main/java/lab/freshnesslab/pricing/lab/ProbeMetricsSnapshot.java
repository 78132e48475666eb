package lab.freshnesslab.pricing.lab;

import java.util.Map;

/**
 * Keyed by backend stats key.
 */
public record ProbeMetricsSnapshot(
        long startedAtMs,
        Map<String, BackendProbeSnapshot> backends) {
}

package lab.freshnesslab.pricing.domain;

import java.util.Map;

public record MetricsSnapshot(
        long productId,
        long timestamp,
        String isolationLevel,
        int refreshIntervalSeconds,
        Map<String, BackendSnapshot> backends) {
}

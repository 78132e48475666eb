package lab.freshnesslab.pricing.domain;

import java.math.BigDecimal;

public record BackendSnapshot(
        Double qps,
        Double latencyMs,
        Double endToEndLatencyMs,
        BigDecimal price,
        Double freshnessSeconds,
        Double refreshDurationSeconds,
        WindowStats latencyStats,
        WindowStats endToEndStats,
        WindowStats refreshStats) {

    private static final BackendSnapshot UNAVAILABLE =
            new BackendSnapshot(null, null, null, null, null, null, null, null, null);

    public static BackendSnapshot unavailable() {
        return UNAVAILABLE;
    }
}

package lab.freshnesslab.pricing.lab;

public record BackendProbeSnapshot(
        ProbeLatencyStats latencyNs,
        long successCount,
        long failCount) {
}

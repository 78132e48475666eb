package lab.freshnesslab.pricing.lab;

public record ProbeLatencyStats(
        long count,
        long minNs,
        long maxNs,
        double avgNs,
        long p95Ns,
        long p99Ns) {

    public static final ProbeLatencyStats EMPTY = new ProbeLatencyStats(0L, 0L, 0L, 0.0, 0L, 0L);
}

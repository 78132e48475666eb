package lab.freshnesslab.pricing.domain;

public record WindowStats(double max, double average, double p99) {

    public static final WindowStats EMPTY = new WindowStats(0.0, 0.0, 0.0);
}

package lab.freshnesslab.pricing.dto;

public record TrafficResponse(String backend, boolean enabled, int activeWorkers, int limit) {
}

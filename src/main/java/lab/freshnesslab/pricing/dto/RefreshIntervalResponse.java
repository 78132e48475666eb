package lab.freshnesslab.pricing.dto;

public record RefreshIntervalResponse(String status, int refreshInterval) {
}

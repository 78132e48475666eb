package lab.freshnesslab.pricing.dto;

public record RefreshResponse(String status, double durationSeconds) {
}

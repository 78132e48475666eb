package lab.freshnesslab.pricing.dto;

public record IsolationResponse(String status, String isolationLevel) {
}

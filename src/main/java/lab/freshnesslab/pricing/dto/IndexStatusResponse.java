package lab.freshnesslab.pricing.dto;

public record IndexStatusResponse(String message, boolean indexExists) {
}

package lab.freshnesslab.pricing.dto;

public record DatabaseSizeResponse(double sizeGb) {
}

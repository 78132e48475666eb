package lab.freshnesslab.pricing.dto;

public record ApiError(String status, String message) {

    public static ApiError of(String message) {
        return new ApiError("error", message);
    }
}

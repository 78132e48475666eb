package lab.freshnesslab.pricing.exception;

public class InvalidRefreshIntervalException extends RuntimeException {

    private final int requestedSeconds;

    public InvalidRefreshIntervalException(int requestedSeconds, int minimumSeconds) {
        super("Interval must be at least " + minimumSeconds + " second(s), got " + requestedSeconds);
        this.requestedSeconds = requestedSeconds;
    }

    public int getRequestedSeconds() {
        return requestedSeconds;
    }
}

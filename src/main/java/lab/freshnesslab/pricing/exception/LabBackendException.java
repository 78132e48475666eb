package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

public class LabBackendException extends RuntimeException {

    private final BackendFamily family;
    private final boolean retryable;

    public LabBackendException(String message, BackendFamily family, boolean retryable) {
        super(message);
        this.family = family;
        this.retryable = retryable;
    }

    public LabBackendException(String message, BackendFamily family, boolean retryable, Throwable cause) {
        super(message, cause);
        this.family = family;
        this.retryable = retryable;
    }

    public BackendFamily getFamily() {
        return family;
    }

    public boolean isRetryable() {
        return retryable;
    }
}

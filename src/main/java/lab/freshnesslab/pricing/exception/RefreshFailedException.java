package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

public class RefreshFailedException extends LabBackendException {

    public RefreshFailedException(String viewName, Throwable cause) {
        super("Refresh of " + viewName + " failed: " + cause.getMessage(), BackendFamily.POSTGRES, true, cause);
    }
}

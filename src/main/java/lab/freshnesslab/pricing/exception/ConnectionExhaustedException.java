package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

public class ConnectionExhaustedException extends LabBackendException {

    public ConnectionExhaustedException(BackendFamily family, int attempts, Throwable cause) {
        super(family.displayName() + " pool exhausted after " + attempts + " attempts", family, true, cause);
    }
}

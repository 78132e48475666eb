package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

public class PoolInitializationException extends LabBackendException {

    public PoolInitializationException(BackendFamily family, Throwable cause) {
        super(family.displayName() + " pool creation failed: " + cause.getMessage(), family, false, cause);
    }
}

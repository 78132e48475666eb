package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

/**
 * The backend has not caught up with the schema yet (missing relation).
 */
public class BackendNotReadyException extends LabBackendException {

    public BackendNotReadyException(BackendFamily family, Throwable cause) {
        super(family.displayName() + " is not ready: " + cause.getMessage(), family, true, cause);
    }
}

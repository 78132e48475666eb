package lab.freshnesslab.pricing.exception;

import lab.freshnesslab.pricing.domain.BackendFamily;

public class PoolUnavailableException extends LabBackendException {

    public PoolUnavailableException(BackendFamily family) {
        super(family.displayName() + " pool is not initialized", family, true);
    }
}

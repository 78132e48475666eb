package lab.freshnesslab.pricing.exception;

import java.time.Duration;
import lab.freshnesslab.pricing.domain.Backend;

public class ProbeTimeoutException extends LabBackendException {

    public ProbeTimeoutException(Backend backend, Duration elapsed, Throwable cause) {
        super(backend.displayName() + " query timed out after " + elapsed.toMillis() + "ms",
                backend.family(), true, cause);
    }
}

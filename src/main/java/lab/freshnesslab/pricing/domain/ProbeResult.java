package lab.freshnesslab.pricing.domain;

import java.time.Duration;

public record ProbeResult(Backend backend, Duration duration, PriceRow row) {

    public boolean succeeded() {
        return row != null;
    }
}

package lab.freshnesslab.pricing.domain;

import java.time.Instant;

public record Heartbeat(long sequenceId, Instant timestamp) {
}

package lab.freshnesslab.pricing.domain;

import java.time.Instant;

/**
 * Latest baseline heartbeat together with the baseline server clock read in the same statement.
 */
public record BaselineHeartbeat(Heartbeat heartbeat, Instant serverNow) {

    public long sequenceId() {
        return heartbeat.sequenceId();
    }

    public Instant timestamp() {
        return heartbeat.timestamp();
    }
}

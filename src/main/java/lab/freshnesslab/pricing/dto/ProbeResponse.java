package lab.freshnesslab.pricing.dto;

import java.math.BigDecimal;
import java.time.Instant;
import lab.freshnesslab.pricing.domain.ProbeResult;

public record ProbeResponse(
        String backend,
        boolean succeeded,
        double latencyMs,
        BigDecimal price,
        Instant lastUpdateTime) {

    public static ProbeResponse from(ProbeResult result) {
        return new ProbeResponse(result.backend().statsKey(),
                result.succeeded(),
                result.duration().toNanos() / 1_000_000.0,
                result.succeeded() ? result.row().adjustedPrice() : null,
                result.succeeded() ? result.row().lastUpdateTime() : null);
    }
}

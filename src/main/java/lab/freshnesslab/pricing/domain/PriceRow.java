package lab.freshnesslab.pricing.domain;

import java.math.BigDecimal;
import java.time.Instant;

public record PriceRow(long productId, BigDecimal adjustedPrice, Instant lastUpdateTime) {
}

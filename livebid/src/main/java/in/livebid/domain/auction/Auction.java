package in.livebid.domain.auction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Auction metadata as registered by the product catalog.
 *
 * The time window is half-open: bids are accepted for {@code startTime <= now < endTime}.
 */
public record Auction(
    String productId,
    BigDecimal basePrice,
    Instant startTime,
    Instant endTime
) {
    public Auction {
        Objects.requireNonNull(productId, "productId");
        Objects.requireNonNull(basePrice, "basePrice");
        Objects.requireNonNull(startTime, "startTime");
        Objects.requireNonNull(endTime, "endTime");
        if (basePrice.signum() < 0) {
            throw new IllegalArgumentException("Base price must not be negative: " + basePrice);
        }
        if (!endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("End time must be after start time for " + productId);
        }
    }

    /**
     * Status implied by the time window alone.
     */
    public AuctionStatus statusAt(Instant now) {
        if (now.isBefore(startTime)) {
            return AuctionStatus.PENDING;
        }
        if (now.isBefore(endTime)) {
            return AuctionStatus.OPEN;
        }
        return AuctionStatus.CLOSED;
    }
}

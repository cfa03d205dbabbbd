package in.livebid.room;

import in.livebid.domain.auction.AuctionStatus;
import in.livebid.domain.auction.Bid;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.bid.RejectReason;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Validates and totally orders bids for one room. Confined to the room's serialization point.
 *
 * Validation order:
 * 1. Room must be OPEN                                  → AUCTION_NOT_OPEN
 * 2. Amount must beat the highest bid (≥ base if none)  → AMOUNT_TOO_LOW
 * 3. Bidder identity must be present                    → UNAUTHORIZED
 */
final class BidSequencer {

    private final String productId;
    private final BigDecimal basePrice;
    private final Clock clock;
    private final int recentCapacity;

    private final Deque<Bid> recent = new ArrayDeque<>();
    private Bid highest;
    private long lastSequence;

    BidSequencer(String productId, BigDecimal basePrice, Clock clock, int recentCapacity) {
        this.productId = productId;
        this.basePrice = basePrice;
        this.clock = clock;
        this.recentCapacity = recentCapacity;
    }

    BidResult sequence(AuctionStatus status, String bidderId, BigDecimal amount) {
        if (!status.acceptsBids()) {
            return BidResult.rejected(productId, RejectReason.AUCTION_NOT_OPEN);
        }
        if (!isHighEnough(amount)) {
            return BidResult.tooLow(productId, currentHighestAmount());
        }
        if (bidderId == null || bidderId.isBlank()) {
            return BidResult.rejected(productId, RejectReason.UNAUTHORIZED);
        }

        Bid bid = new Bid(++lastSequence, bidderId, amount, clock.instant());
        highest = bid;
        recent.addLast(bid);
        while (recent.size() > recentCapacity) {
            recent.removeFirst();
        }
        return BidResult.accepted(productId, bid);
    }

    private boolean isHighEnough(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return false;
        }
        if (highest == null) {
            return amount.compareTo(basePrice) >= 0;
        }
        return amount.compareTo(highest.amount()) > 0;
    }

    Optional<Bid> highest() {
        return Optional.ofNullable(highest);
    }

    BigDecimal currentHighestAmount() {
        return highest == null ? null : highest.amount();
    }

    long lastSequence() {
        return lastSequence;
    }

    /**
     * Oldest first.
     */
    List<Bid> recent() {
        return List.copyOf(recent);
    }
}

package in.livebid.room;

import in.livebid.domain.auction.AuctionStatus;
import in.livebid.domain.auction.Bid;
import in.livebid.domain.event.OutboundMessage;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Consistent view of a room handed to a newly attached subscriber.
 *
 * It is always the first message queued to the subscriber; every event that follows has
 * {@code seq > lastEventSeq}.
 */
public record RoomSnapshot(
    String productId,
    AuctionStatus status,
    BigDecimal basePrice,
    Instant startTime,
    Instant endTime,
    Bid highestBid,
    List<Bid> recentBids,
    long lastEventSeq,
    int subscriberCount,
    Instant ts
) implements OutboundMessage {

    public BigDecimal currentHighest() {
        return highestBid == null ? null : highestBid.amount();
    }
}

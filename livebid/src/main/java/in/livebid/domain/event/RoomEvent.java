package in.livebid.domain.event;

import in.livebid.domain.auction.AuctionStatus;
import in.livebid.domain.auction.Bid;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Room-scoped broadcast event.
 *
 * {@code seq} is the per-room event sequence: every subscriber observes events in ascending
 * {@code seq} order, and a client can discard a redelivered event by its {@code seq}.
 */
public record RoomEvent(
    String productId,
    long seq,
    RoomEventType type,
    AuctionStatus status,

    // BID_ACCEPTED only
    Bid bid,

    // Highest accepted amount after this event (null before the first bid)
    BigDecimal currentHighest,

    // AUCTION_CLOSED only
    CloseReason closeReason,

    Instant ts
) implements OutboundMessage {

    public static RoomEvent bidAccepted(String productId, long seq, Bid bid) {
        return new RoomEvent(productId, seq, RoomEventType.BID_ACCEPTED, AuctionStatus.OPEN,
                             bid, bid.amount(), null, bid.acceptedAt());
    }

    public static RoomEvent opened(String productId, long seq, BigDecimal currentHighest, Instant ts) {
        return new RoomEvent(productId, seq, RoomEventType.AUCTION_OPENED, AuctionStatus.OPEN,
                             null, currentHighest, null, ts);
    }

    public static RoomEvent closed(String productId, long seq, Bid winningBid, CloseReason reason, Instant ts) {
        return new RoomEvent(productId, seq, RoomEventType.AUCTION_CLOSED, AuctionStatus.CLOSED,
                             winningBid, winningBid == null ? null : winningBid.amount(), reason, ts);
    }
}

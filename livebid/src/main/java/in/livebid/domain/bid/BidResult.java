package in.livebid.domain.bid;

import in.livebid.domain.auction.Bid;
import in.livebid.domain.event.OutboundMessage;

import java.math.BigDecimal;

/**
 * Outcome of a bid submission.
 *
 * Accepted results carry the sequenced bid. AMOUNT_TOO_LOW rejections carry the current highest
 * amount (null before the first bid) so the caller can retry informed.
 */
public record BidResult(
    String productId,
    boolean accepted,
    Bid bid,
    RejectReason reason,
    BigDecimal currentHighest
) implements OutboundMessage {

    public static BidResult accepted(String productId, Bid bid) {
        return new BidResult(productId, true, bid, null, bid.amount());
    }

    public static BidResult rejected(String productId, RejectReason reason) {
        return new BidResult(productId, false, null, reason, null);
    }

    public static BidResult tooLow(String productId, BigDecimal currentHighest) {
        return new BidResult(productId, false, null, RejectReason.AMOUNT_TOO_LOW, currentHighest);
    }

    public boolean rejectedFor(RejectReason expected) {
        return !accepted && reason == expected;
    }
}

package in.livebid.application.port.output;

import in.livebid.domain.auction.Bid;

/**
 * Persistence collaborator for accepted bids.
 *
 * Fire-and-forget from the room's perspective: failures are handled (logged) by the recorder and
 * never roll back an accepted bid.
 */
public interface BidRecorder {
    void recordBid(String productId, Bid bid);
}

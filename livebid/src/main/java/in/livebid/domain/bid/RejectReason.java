package in.livebid.domain.bid;

/**
 * Why a bid submission was not accepted. Every reason is recoverable by the caller.
 */
public enum RejectReason {
    AUCTION_NOT_OPEN("Auction is not open for bidding"),
    AMOUNT_TOO_LOW("Bid must exceed the current highest bid"),
    UNAUTHORIZED("Bidder is not authenticated or no longer connected"),
    ROOM_UNAVAILABLE("Auction room is unavailable, retry"),
    NOT_FOUND("Unknown product");

    private final String description;

    RejectReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}

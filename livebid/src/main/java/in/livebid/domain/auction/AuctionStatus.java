package in.livebid.domain.auction;

/**
 * Lifecycle status of an auction room.
 *
 * PENDING → OPEN → CLOSED. CLOSED is terminal.
 */
public enum AuctionStatus {
    PENDING,
    OPEN,
    CLOSED;

    public boolean acceptsBids() {
        return this == OPEN;
    }
}

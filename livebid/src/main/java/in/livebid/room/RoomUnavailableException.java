package in.livebid.room;

import in.livebid.domain.bid.RejectReason;

/**
 * Thrown when a room cannot take work: it is saturated, or it was reclaimed while the caller
 * still held a reference.
 */
public class RoomUnavailableException extends RuntimeException {

    private final String productId;

    public RoomUnavailableException(String productId, String message) {
        super(String.format("[%s] %s", productId, message));
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }

    public RejectReason getReason() {
        return RejectReason.ROOM_UNAVAILABLE;
    }
}

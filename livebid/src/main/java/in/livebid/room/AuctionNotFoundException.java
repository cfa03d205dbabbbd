package in.livebid.room;

import in.livebid.domain.bid.RejectReason;

/**
 * Thrown when a room is requested for a product the catalog does not know.
 */
public class AuctionNotFoundException extends RuntimeException {

    private final String productId;

    public AuctionNotFoundException(String productId) {
        super(String.format("[%s] No auction registered for product", productId));
        this.productId = productId;
    }

    public String getProductId() {
        return productId;
    }

    public RejectReason getReason() {
        return RejectReason.NOT_FOUND;
    }
}

package in.livebid.domain.session;

import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.room.Room;

/**
 * One connection's membership in an auction room.
 */
public final class AuctionSession {
    private final String sessionId;
    private final String productId;
    private final String bidderId;      // null for watch-only connections
    private final ConnectionHandle handle;
    private final Room room;

    public AuctionSession(String sessionId, String productId, String bidderId, ConnectionHandle handle, Room room) {
        this.sessionId = sessionId;
        this.productId = productId;
        this.bidderId = bidderId;
        this.handle = handle;
        this.room = room;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getProductId() {
        return productId;
    }

    public String getBidderId() {
        return bidderId;
    }

    public ConnectionHandle getHandle() {
        return handle;
    }

    public Room getRoom() {
        return room;
    }

    /**
     * Check if session may bid (has a bidder ID).
     */
    public boolean isAuthenticated() {
        return bidderId != null && !bidderId.isEmpty();
    }
}

package in.livebid.application.port.input;

import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.session.AuctionSession;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;

/**
 * Entry points the transport layer drives for each connection.
 */
public interface AuctionSessionService {

    /**
     * Attach a new connection to the product's room. The room snapshot is the first message
     * the connection receives.
     *
     * @param bidderId Authenticated bidder, or null for a watch-only connection
     * @throws in.livebid.room.AuctionNotFoundException if the product is unknown
     * @throws in.livebid.room.RoomUnavailableException if the room cannot take subscribers
     */
    AuctionSession onConnect(String productId, String bidderId, ConnectionHandle handle);

    /**
     * Handle one raw client message (bid or ping). Never blocks the calling I/O thread.
     */
    void onMessage(AuctionSession session, String rawPayload);

    /**
     * Detach the connection. Idempotent.
     */
    void onDisconnect(AuctionSession session);

    /**
     * Submit a bid for the session's connection.
     */
    CompletableFuture<BidResult> submitBid(AuctionSession session, BigDecimal amount);

    /**
     * Administrative close of a live auction.
     *
     * @return future completing with true if this call closed the auction
     */
    CompletableFuture<Boolean> closeAuction(String productId);

    int getSessionCount();
}

package in.livebid.application.service;

import in.livebid.application.port.input.AuctionSessionService;
import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.bid.BidRequest;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.bid.RejectReason;
import in.livebid.domain.event.OutboundMessage;
import in.livebid.domain.event.SessionNotice;
import in.livebid.domain.session.AuctionSession;
import in.livebid.room.RoomAttachment;
import in.livebid.room.RoomRegistry;
import in.livebid.security.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Bridges connections to rooms.
 *
 * FLOW:
 * 1. onConnect  → registry attach (room created on first use), snapshot queued to the handle
 * 2. onMessage  → parse → bid into the room mailbox, or answer ping/errors directly
 * 3. onDisconnect → room detach, then the registry reclaims CLOSED rooms with no subscribers
 *
 * Nothing here blocks the transport's I/O thread: bids complete asynchronously and their
 * results travel through the subscriber's own outbound queue.
 */
public final class AuctionSessionServiceImpl implements AuctionSessionService {
    private static final Logger log = LoggerFactory.getLogger(AuctionSessionServiceImpl.class);

    private final RoomRegistry registry;
    private final InputValidator validator;
    private final BidRequestParser parser;

    // Handle id -> session
    private final ConcurrentMap<String, AuctionSession> sessions = new ConcurrentHashMap<>();

    public AuctionSessionServiceImpl(RoomRegistry registry, InputValidator validator) {
        this.registry = registry;
        this.validator = validator;
        this.parser = new BidRequestParser(validator);
    }

    @Override
    public AuctionSession onConnect(String productId, String bidderId, ConnectionHandle handle) {
        if (!validator.isValidProductId(productId)) {
            throw new IllegalArgumentException("Invalid product id: " + productId);
        }

        RoomAttachment attachment = registry.attach(productId, handle, bidderId);
        AuctionSession session = new AuctionSession(
            UUID.randomUUID().toString(), productId, bidderId, handle, attachment.room());
        sessions.put(handle.id(), session);

        attachment.snapshot().whenComplete((snapshot, error) -> {
            if (error != null) {
                log.warn("[{}] Attach failed for {}: {}", productId, handle.id(), error.toString());
                sessions.remove(handle.id(), session);
                sendDirect(handle, SessionNotice.error(productId, RejectReason.ROOM_UNAVAILABLE, "Auction room unavailable"));
                handle.close();
            }
        });

        log.info("[{}] Session connected: {} (bidder={}, session={})",
            productId, handle.id(), bidderId == null ? "watch-only" : bidderId, session.getSessionId());
        return session;
    }

    @Override
    public void onMessage(AuctionSession session, String rawPayload) {
        BidRequest request;
        try {
            request = parser.parse(rawPayload);
        } catch (MalformedMessageException e) {
            log.warn("[{}] Malformed message from {}: {}", session.getProductId(), session.getHandle().id(), e.getMessage());
            sendDirect(session.getHandle(), SessionNotice.error(session.getProductId(), e.getMessage()));
            return;
        }

        switch (request.action()) {
            case PING -> sendDirect(session.getHandle(), SessionNotice.pong(session.getProductId(), request.nonce()));
            case BID -> submitBid(session, request.amount());
        }
    }

    @Override
    public CompletableFuture<BidResult> submitBid(AuctionSession session, BigDecimal amount) {
        return session.getRoom().submitBidAsync(session.getHandle(), amount)
            .whenComplete((result, error) -> {
                if (error != null) {
                    log.error("[{}] Bid submission failed for {}", session.getProductId(), session.getHandle().id(), error);
                } else if (result.rejectedFor(RejectReason.ROOM_UNAVAILABLE)) {
                    // Never reached the room, so it was not queued to the subscriber
                    sendDirect(session.getHandle(), result);
                }
            });
    }

    @Override
    public void onDisconnect(AuctionSession session) {
        ConnectionHandle handle = session.getHandle();
        if (!sessions.remove(handle.id(), session)) {
            return;
        }
        session.getRoom().detach(handle);
        log.info("[{}] Session disconnected: {} (bidder={}, session={})",
            session.getProductId(), handle.id(),
            session.isAuthenticated() ? session.getBidderId() : "watch-only", session.getSessionId());
    }

    @Override
    public CompletableFuture<Boolean> closeAuction(String productId) {
        return registry.closeAuction(productId);
    }

    @Override
    public int getSessionCount() {
        return sessions.size();
    }

    private void sendDirect(ConnectionHandle handle, OutboundMessage message) {
        if (!handle.isOpen()) {
            return;
        }
        try {
            handle.send(message);
        } catch (IOException e) {
            log.warn("Direct send to {} failed: {}", handle.id(), e.toString());
        }
    }
}

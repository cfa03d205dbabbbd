package in.livebid.transport.ws;

import in.livebid.application.port.input.AuctionSessionService;
import in.livebid.domain.bid.RejectReason;
import in.livebid.domain.event.SessionNotice;
import in.livebid.domain.session.AuctionSession;
import in.livebid.room.AuctionNotFoundException;
import in.livebid.room.RoomUnavailableException;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Undertow-native WebSocket hub for auction rooms:
 * - One connection per product room ({@code ?productId=xxx})
 * - Optional bidder token ({@code &token=xxx}); without a valid one the connection is watch-only
 * - Inbound messages handed to the session service, outbound delivered through the room
 */
public final class AuctionWsHub {
    private static final Logger log = LoggerFactory.getLogger(AuctionWsHub.class);

    private static final int DEFAULT_MAX_IN_FLIGHT = 512;

    // Channel -> Session
    private final ConcurrentMap<WebSocketChannel, AuctionSession> sessions = new ConcurrentHashMap<>();

    private final AuctionSessionService service;
    private final RoomEventJsonMapper mapper;
    private final int maxInFlight;

    // Token validator: token -> bidderId (null if invalid)
    private final Function<String, String> tokenValidator;

    public AuctionWsHub(AuctionSessionService service, Function<String, String> tokenValidator) {
        this(service, tokenValidator, new RoomEventJsonMapper(), DEFAULT_MAX_IN_FLIGHT);
    }

    public AuctionWsHub(AuctionSessionService service, Function<String, String> tokenValidator,
                        RoomEventJsonMapper mapper, int maxInFlight) {
        this.service = service;
        this.tokenValidator = tokenValidator;
        this.mapper = mapper;
        this.maxInFlight = maxInFlight;
    }

    public WebSocketProtocolHandshakeHandler websocketHandler() {
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                handleConnect(exchange.getQueryString(), channel);
            }
        });
    }

    void handleConnect(String query, WebSocketChannel channel) {
        String productId = queryParam(query, "productId");
        if (productId == null) {
            rejectConnection(channel, null, null, "Missing productId");
            return;
        }

        String token = queryParam(query, "token");
        String bidderId = token == null ? null : tokenValidator.apply(token);
        if (token != null && bidderId == null) {
            log.warn("[{}] Invalid token from {}, connecting watch-only", productId, channel.getSourceAddress());
        }

        WebSocketConnectionHandle handle = new WebSocketConnectionHandle(
            UUID.randomUUID().toString(), channel, mapper, maxInFlight);

        AuctionSession session;
        try {
            session = service.onConnect(productId, bidderId, handle);
        } catch (AuctionNotFoundException e) {
            rejectConnection(channel, productId, e.getReason(), "Unknown auction: " + productId);
            return;
        } catch (RoomUnavailableException e) {
            rejectConnection(channel, productId, e.getReason(), "Auction room unavailable");
            return;
        } catch (IllegalArgumentException e) {
            rejectConnection(channel, productId, null, e.getMessage());
            return;
        }

        sessions.put(channel, session);
        channel.addCloseTask(this::cleanup);

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                AuctionSession s = sessions.get(ch);
                if (s != null) {
                    service.onMessage(s, message.getData());
                }
            }

            @Override
            protected void onCloseMessage(CloseMessage cm, WebSocketChannel ch) {
                cleanup(ch);
                super.onCloseMessage(cm, ch);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.warn("[{}] WS error on {}: {}", productId, handle.id(), error.toString());
                cleanup(ch);
                super.onError(ch, error);
            }
        });
        channel.resumeReceives();

        log.info("[{}] WS connected: {} (bidder={}, handle={})",
            productId, channel.getSourceAddress(), bidderId == null ? "watch-only" : bidderId, handle.id());
    }

    static String queryParam(String query, String name) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String prefix = name + "=";
        for (String param : query.split("&")) {
            if (param.startsWith(prefix)) {
                String value = URLDecoder.decode(param.substring(prefix.length()), StandardCharsets.UTF_8);
                return value.isEmpty() ? null : value;
            }
        }
        return null;
    }

    private void rejectConnection(WebSocketChannel channel, String productId, RejectReason reason, String error) {
        log.warn("[{}] WS connection rejected from {}: {}", productId, channel.getSourceAddress(), error);
        // Close only once the error frame has been written
        WebSockets.sendText(mapper.toJson(SessionNotice.error(productId, reason, error)), channel,
            new WebSocketCallback<Void>() {
                @Override
                public void complete(WebSocketChannel ch, Void context) {
                    closeQuietly(ch);
                }

                @Override
                public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                    log.debug("[{}] Error frame not delivered: {}", productId, throwable.toString());
                    closeQuietly(ch);
                }
            });
    }

    private void cleanup(WebSocketChannel channel) {
        AuctionSession session = sessions.remove(channel);
        if (session != null) {
            service.onDisconnect(session);
            log.info("[{}] WS disconnected: {} (session={})",
                session.getProductId(), channel.getSourceAddress(), session.getSessionId());
        }
        closeQuietly(channel);
    }

    private static void closeQuietly(WebSocketChannel channel) {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close failed: {}", e.toString());
        }
    }

    /**
     * Get total connection count.
     */
    public int getConnectionCount() {
        return sessions.size();
    }

    /**
     * Detach every connection. Used on shutdown.
     */
    public void closeAll() {
        log.info("Closing {} WS connections", sessions.size());
        sessions.keySet().forEach(this::cleanup);
    }
}

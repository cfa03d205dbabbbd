package in.livebid.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.livebid.application.port.input.AuctionSessionService;
import in.livebid.room.AuctionNotFoundException;
import in.livebid.room.RoomRegistry;
import in.livebid.security.InputValidator;
import in.livebid.transport.ws.AuctionWsHub;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Deque;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * HTTP endpoints next to the WebSocket hub: health and administrative close.
 */
public final class AuctionHttpHandlers {
    private static final Logger log = LoggerFactory.getLogger(AuctionHttpHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String JSON_ERROR = "error";
    private static final long CLOSE_TIMEOUT_SECONDS = 5;

    private final AuctionSessionService service;
    private final RoomRegistry registry;
    private final AuctionWsHub wsHub;
    private final InputValidator validator;
    private final byte[] adminToken;    // null disables admin endpoints

    public AuctionHttpHandlers(AuctionSessionService service, RoomRegistry registry, AuctionWsHub wsHub,
                               InputValidator validator, String adminToken) {
        this.service = service;
        this.registry = registry;
        this.wsHub = wsHub;
        this.validator = validator;
        this.adminToken = adminToken == null || adminToken.isEmpty()
            ? null
            : adminToken.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "ok");
        health.put("ts", Instant.now().toString());
        health.put("rooms", registry.roomCount());
        health.put("subscribers", registry.subscriberCount());
        health.put("sessions", service.getSessionCount());
        health.put("connections", wsHub.getConnectionCount());
        sendJson(exchange, StatusCodes.OK, health);
    }

    /**
     * POST /api/admin/auctions/{productId}/close
     * Requires {@code Authorization: Bearer <ADMIN_TOKEN>}.
     */
    public void closeAuction(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::closeAuction);
            return;
        }

        if (!isAdmin(exchange)) {
            sendError(exchange, StatusCodes.FORBIDDEN, "Admin token required");
            return;
        }

        Deque<String> param = exchange.getQueryParameters().get("productId");
        String productId = param == null ? null : param.peekFirst();
        if (!validator.isValidProductId(productId)) {
            sendError(exchange, StatusCodes.BAD_REQUEST, "Invalid product id");
            return;
        }

        try {
            boolean closed = service.closeAuction(productId).get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            ObjectNode body = MAPPER.createObjectNode();
            body.put("productId", productId);
            body.put("closed", closed);
            body.put("message", closed ? "Auction closed" : "Auction was already closed");
            log.info("[{}] Admin close via HTTP: closed={}", productId, closed);
            sendJson(exchange, StatusCodes.OK, body);
        } catch (AuctionNotFoundException e) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Unknown auction: " + productId);
        } catch (TimeoutException e) {
            log.warn("[{}] Admin close timed out after {}s", productId, CLOSE_TIMEOUT_SECONDS);
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Close did not complete in time");
        } catch (ExecutionException e) {
            log.error("[{}] Admin close failed", productId, e.getCause());
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Close failed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Interrupted");
        }
    }

    private boolean isAdmin(HttpServerExchange exchange) {
        if (adminToken == null) {
            return false;
        }
        String header = exchange.getRequestHeaders().getFirst(Headers.AUTHORIZATION);
        if (header == null || !header.startsWith("Bearer ")) {
            return false;
        }
        return MessageDigest.isEqual(adminToken, header.substring(7).getBytes(StandardCharsets.UTF_8));
    }

    private void sendError(HttpServerExchange exchange, int status, String message) {
        ObjectNode body = MAPPER.createObjectNode();
        body.put(JSON_ERROR, message);
        sendJson(exchange, status, body);
    }

    private void sendJson(HttpServerExchange exchange, int status, ObjectNode body) {
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(body.toString());
    }
}

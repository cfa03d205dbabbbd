package in.livebid.domain.event;

import in.livebid.domain.bid.RejectReason;

import java.time.Instant;

/**
 * Connection-level message that is not part of the room's event stream: ping replies and
 * protocol errors.
 */
public record SessionNotice(
    String productId,
    Kind kind,
    String message,
    RejectReason reason,    // ERROR only, when the failure maps to a rejection reason
    String nonce,
    Instant ts
) implements OutboundMessage {

    public enum Kind {
        PONG,
        ERROR
    }

    public static SessionNotice pong(String productId, String nonce) {
        return new SessionNotice(productId, Kind.PONG, null, null, nonce, Instant.now());
    }

    public static SessionNotice error(String productId, String message) {
        return error(productId, null, message);
    }

    public static SessionNotice error(String productId, RejectReason reason, String message) {
        return new SessionNotice(productId, Kind.ERROR, message, reason, null, Instant.now());
    }
}

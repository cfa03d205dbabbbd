package in.livebid.domain.event;

/**
 * Anything the room engine hands to a connection for delivery.
 */
public interface OutboundMessage {
    String productId();
}

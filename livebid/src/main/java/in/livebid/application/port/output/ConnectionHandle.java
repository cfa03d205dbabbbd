package in.livebid.application.port.output;

import in.livebid.domain.event.OutboundMessage;

import java.io.IOException;

/**
 * One subscriber's bidirectional channel, owned by the transport layer.
 *
 * Rooms hold a non-owning membership reference only. Implementations must not block in
 * {@link #send} beyond their own bounded buffering; a channel that cannot take more output
 * should throw instead.
 */
public interface ConnectionHandle {

    /**
     * Stable identifier, unique among live connections.
     */
    String id();

    boolean isOpen();

    /**
     * Deliver one message to the remote peer.
     *
     * @throws IOException if the channel is closed or its outbound buffer is exhausted
     */
    void send(OutboundMessage message) throws IOException;

    /**
     * Close the underlying channel. Idempotent.
     */
    void close();
}

package in.livebid.transport.ws;

import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.event.OutboundMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConnectionHandle} over an Undertow WebSocket channel.
 *
 * Sends are asynchronous; the handle counts frames handed to Undertow but not yet written and
 * refuses new ones beyond {@code maxInFlight}, which the room treats as a failed subscriber.
 */
public final class WebSocketConnectionHandle implements ConnectionHandle {
    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionHandle.class);

    private final String id;
    private final WebSocketChannel channel;
    private final RoomEventJsonMapper mapper;
    private final int maxInFlight;
    private final AtomicInteger inFlight = new AtomicInteger();

    private final WebSocketCallback<Void> callback = new WebSocketCallback<>() {
        @Override
        public void complete(WebSocketChannel ch, Void context) {
            inFlight.decrementAndGet();
        }

        @Override
        public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
            inFlight.decrementAndGet();
            log.debug("WS send to {} failed: {}", id, throwable.toString());
        }
    };

    public WebSocketConnectionHandle(String id, WebSocketChannel channel, RoomEventJsonMapper mapper, int maxInFlight) {
        this.id = id;
        this.channel = channel;
        this.mapper = mapper;
        this.maxInFlight = maxInFlight;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen() && !channel.isCloseFrameSent();
    }

    @Override
    public synchronized void send(OutboundMessage message) throws IOException {
        if (!isOpen()) {
            throw new IOException("Channel closed: " + id);
        }
        if (inFlight.get() >= maxInFlight) {
            throw new IOException("Outbound buffer exhausted for " + id + " (" + maxInFlight + " frames in flight)");
        }
        String json = mapper.toJson(message);
        inFlight.incrementAndGet();
        WebSockets.sendText(json, channel, callback);
    }

    @Override
    public void close() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("WS close of {} failed: {}", id, e.toString());
        }
    }

    public String getSourceAddress() {
        return String.valueOf(channel.getSourceAddress());
    }
}

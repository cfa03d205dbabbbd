package in.livebid.room;

import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.event.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Room membership of one connection plus its outbound delivery task.
 *
 * The room thread only ever offers into the bounded queue; a delivery thread drains it into the
 * connection. At most one drain runs at a time, so messages reach the connection in the order the
 * room queued them. Once cancelled, nothing further is sent.
 */
final class Subscriber {
    private static final Logger log = LoggerFactory.getLogger(Subscriber.class);

    private static final int DRAIN_BATCH = 64;

    private final String productId;
    private final ConnectionHandle handle;
    private final String bidderId;
    private final BlockingQueue<OutboundMessage> outbound;
    private final Executor delivery;
    private final Consumer<Subscriber> onSendFailure;

    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile boolean cancelled;

    Subscriber(String productId, ConnectionHandle handle, String bidderId, int capacity,
               Executor delivery, Consumer<Subscriber> onSendFailure) {
        this.productId = productId;
        this.handle = handle;
        this.bidderId = bidderId;
        this.outbound = new ArrayBlockingQueue<>(capacity);
        this.delivery = delivery;
        this.onSendFailure = onSendFailure;
    }

    String id() {
        return handle.id();
    }

    ConnectionHandle handle() {
        return handle;
    }

    /**
     * Null for watch-only connections.
     */
    String bidderId() {
        return bidderId;
    }

    boolean isCancelled() {
        return cancelled;
    }

    int backlog() {
        return outbound.size();
    }

    /**
     * Queue a message without blocking.
     *
     * @return false if the queue is full (the caller evicts this subscriber)
     */
    boolean offer(OutboundMessage message) {
        if (cancelled) {
            return true;
        }
        if (!outbound.offer(message)) {
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * Stop delivery and drop anything still queued.
     */
    void cancel() {
        cancelled = true;
        outbound.clear();
    }

    private void scheduleDrain() {
        if (outbound.isEmpty() || !draining.compareAndSet(false, true)) {
            return;
        }
        try {
            delivery.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("[{}] Delivery pool rejected drain for {}: {}", productId, handle.id(), e.toString());
        }
    }

    private void drain() {
        try {
            for (int i = 0; i < DRAIN_BATCH && !cancelled; i++) {
                OutboundMessage message = outbound.poll();
                if (message == null) {
                    break;
                }
                try {
                    handle.send(message);
                } catch (IOException | RuntimeException e) {
                    log.warn("[{}] Send to {} failed, detaching: {}", productId, handle.id(), e.toString());
                    cancel();
                    onSendFailure.accept(this);
                    return;
                }
            }
        } finally {
            draining.set(false);
            if (!cancelled) {
                scheduleDrain();
            }
        }
    }
}

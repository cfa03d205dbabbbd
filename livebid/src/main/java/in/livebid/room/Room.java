package in.livebid.room;

import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.auction.Auction;
import in.livebid.domain.auction.AuctionStatus;
import in.livebid.domain.auction.Bid;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.bid.RejectReason;
import in.livebid.domain.event.CloseReason;
import in.livebid.domain.event.RoomEvent;
import in.livebid.infrastructure.metrics.AuctionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Live state of one auction: highest bid, subscribers and lifecycle.
 *
 * STATE MACHINE:
 * PENDING → OPEN at start time (timer, or lazily on the first interaction after it).
 * OPEN → CLOSED at end time (timer or lazily) or on administrative close.
 * Nothing leaves CLOSED.
 *
 * EXECUTION MODEL:
 * Every mutation (attach, detach, bid, transition) runs as a task on the room's mailbox, so
 * they are totally ordered and the fields below need no locking. Public methods only enqueue
 * and return futures. The reference count is the one piece of state touched outside the
 * mailbox: it is what the registry checks, atomically, before reclaiming the room.
 */
public final class Room {
    private static final Logger log = LoggerFactory.getLogger(Room.class);

    private static final int RETIRED = -1;

    private final Auction auction;
    private final String productId;
    private final RoomContext context;
    private final AuctionMetrics metrics;
    private final RoomMailbox mailbox;
    private final BidSequencer sequencer;
    private final BroadcastFanout fanout = new BroadcastFanout();
    private final Consumer<Room> onReclaimable;

    // Attached subscribers, or RETIRED once the registry has reclaimed the room
    private final AtomicInteger references = new AtomicInteger();

    // Written on the mailbox only; volatile for monitoring reads and the retire check
    private volatile AuctionStatus status;
    private long eventSeq;

    private volatile ScheduledFuture<?> startTimer;
    private volatile ScheduledFuture<?> endTimer;

    /**
     * @param closed true to start CLOSED regardless of the auction window (administratively closed earlier)
     */
    Room(Auction auction, RoomContext context, Consumer<Room> onReclaimable, boolean closed) {
        this.auction = auction;
        this.productId = auction.productId();
        this.context = context;
        this.metrics = context.metrics();
        this.onReclaimable = onReclaimable;
        this.mailbox = new RoomMailbox("room:" + productId, context.dispatcher(), context.settings().mailboxCapacity());
        this.sequencer = new BidSequencer(productId, auction.basePrice(), context.clock(), context.settings().recentBids());
        this.status = closed ? AuctionStatus.CLOSED : auction.statusAt(context.clock().instant());
    }

    /**
     * Arm the start timer (PENDING auctions) and the end timer.
     */
    void armTimers() {
        AuctionTimer timer = context.timer();
        if (status == AuctionStatus.PENDING) {
            startTimer = timer.scheduleAt(auction.startTime(), () -> mailbox.enqueueSystem(this::doOpen));
        }
        if (status != AuctionStatus.CLOSED) {
            endTimer = timer.scheduleAt(auction.endTime(), () -> close(CloseReason.EXPIRED));
        }
        log.info("[{}] Room created: status={}, basePrice={}, window=[{} .. {})",
            productId, status, auction.basePrice(), auction.startTime(), auction.endTime());
    }

    public String productId() {
        return productId;
    }

    public AuctionStatus status() {
        return status;
    }

    public int subscriberCount() {
        return Math.max(0, references.get());
    }

    public boolean isRetired() {
        return references.get() == RETIRED;
    }

    // ═══════════════════════════════════════════════════════════════
    // MEMBERSHIP
    // ═══════════════════════════════════════════════════════════════

    /**
     * Attach a watch-only subscriber.
     */
    public CompletableFuture<RoomSnapshot> attach(ConnectionHandle handle) {
        return attach(handle, null);
    }

    /**
     * Attach a subscriber. The returned snapshot is also queued to the handle as its first
     * message, ahead of any event published after the attach.
     *
     * @param bidderId Authenticated bidder, or null for a watch-only connection
     */
    public CompletableFuture<RoomSnapshot> attach(ConnectionHandle handle, String bidderId) {
        CompletableFuture<RoomSnapshot> attached = tryAttach(handle, bidderId);
        if (attached == null) {
            return CompletableFuture.failedFuture(new RoomUnavailableException(productId, "Room has been reclaimed"));
        }
        return attached;
    }

    /**
     * @return null if the room is already retired (the registry then creates a fresh one)
     */
    CompletableFuture<RoomSnapshot> tryAttach(ConnectionHandle handle, String bidderId) {
        if (!retain()) {
            return null;
        }
        CompletableFuture<RoomSnapshot> result = new CompletableFuture<>();
        boolean queued = mailbox.offer(() -> {
            try {
                result.complete(doAttach(handle, bidderId));
            } catch (RuntimeException e) {
                releaseReference();
                result.completeExceptionally(e);
            }
        });
        if (!queued) {
            releaseReference();
            result.completeExceptionally(new RoomUnavailableException(productId, "Room is not accepting subscribers"));
        }
        return result;
    }

    /**
     * Detach a subscriber. Idempotent; safe after the handle is gone or the room is reclaimed.
     */
    public void detach(ConnectionHandle handle) {
        detach(handle.id(), DetachReason.CLIENT);
    }

    void detach(String handleId, DetachReason reason) {
        // A reclaimed room has no subscribers left, so a refused detach has nothing to undo
        mailbox.enqueueSystem(() -> doDetach(handleId, reason));
    }

    private RoomSnapshot doAttach(ConnectionHandle handle, String bidderId) {
        refreshLifecycle();
        if (fanout.contains(handle.id())) {
            // Repeated attach keeps the single existing membership
            releaseReference();
            return snapshot();
        }
        Subscriber subscriber = new Subscriber(productId, handle, bidderId,
            context.settings().subscriberQueueCapacity(), context.delivery(), this::onSendFailure);
        fanout.add(subscriber);
        RoomSnapshot snapshot = snapshot();
        subscriber.offer(snapshot);
        metrics.recordSubscriberAttached();
        log.debug("[{}] Attached {} (bidder={}, subscribers={})", productId, handle.id(), bidderId, fanout.size());
        return snapshot;
    }

    private void doDetach(String handleId, DetachReason reason) {
        Subscriber subscriber = fanout.remove(handleId);
        if (subscriber == null) {
            return;
        }
        subscriber.cancel();
        if (reason != DetachReason.CLIENT) {
            subscriber.handle().close();
        }
        metrics.recordSubscriberDetached(reason.name());
        if (reason == DetachReason.CLIENT) {
            log.debug("[{}] Detached {} (subscribers={})", productId, handleId, fanout.size());
        } else {
            log.warn("[{}] Detached {} due to {} (backlog={}, subscribers={})",
                productId, handleId, reason, subscriber.backlog(), fanout.size());
        }
        releaseReference();
    }

    private void onSendFailure(Subscriber subscriber) {
        detach(subscriber.id(), DetachReason.SEND_FAILED);
    }

    // ═══════════════════════════════════════════════════════════════
    // BIDDING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Submit a bid and wait, at most the configured submit timeout, for its outcome.
     */
    public BidResult submitBid(String bidderId, BigDecimal amount) {
        return submitBidAsync(bidderId, amount).join();
    }

    /**
     * Submit a bid on behalf of an attached connection, waiting at most the submit timeout.
     */
    public BidResult submitBid(ConnectionHandle handle, BigDecimal amount) {
        return submitBidAsync(handle, amount).join();
    }

    /**
     * Submit a bid. The future always completes, at the latest after the submit timeout, in
     * which case the bid is rejected with ROOM_UNAVAILABLE and is guaranteed not to be sequenced.
     */
    public CompletableFuture<BidResult> submitBidAsync(String bidderId, BigDecimal amount) {
        return enqueueBid(pending -> sequence(bidderId, amount, pending));
    }

    /**
     * Submit a bid on behalf of an attached connection. The bidder is the identity the connection
     * attached with; a connection that is not attached (or is watch-only) is UNAUTHORIZED. The
     * result is also queued to the connection behind any event the bid caused.
     */
    public CompletableFuture<BidResult> submitBidAsync(ConnectionHandle handle, BigDecimal amount) {
        return enqueueBid(pending -> {
            Subscriber subscriber = fanout.get(handle.id());
            String bidderId = subscriber == null ? null : subscriber.bidderId();
            BidResult result = sequence(bidderId, amount, pending);
            if (subscriber != null && !subscriber.isCancelled() && !subscriber.offer(result)) {
                doDetach(subscriber.id(), DetachReason.SLOW_CONSUMER);
            }
            return result;
        });
    }

    private CompletableFuture<BidResult> enqueueBid(Function<PendingBid, BidResult> task) {
        PendingBid pending = new PendingBid();
        // Armed before the offer so that a task completing first always finds it to cancel
        try {
            pending.timeout = context.timer().scheduleAfter(context.settings().submitTimeout(), pending::expire);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Timer stopped, refusing bid", productId);
            return refuse(pending);
        }
        boolean queued = mailbox.offer(() -> {
            if (!pending.claim()) {
                return;
            }
            BidResult result;
            try {
                result = task.apply(pending);
            } catch (RuntimeException e) {
                log.error("[{}] Bid sequencing failed", productId, e);
                result = BidResult.rejected(productId, RejectReason.ROOM_UNAVAILABLE);
            }
            pending.complete(result);
        });
        return queued ? pending.result : refuse(pending);
    }

    private CompletableFuture<BidResult> refuse(PendingBid pending) {
        if (pending.claim()) {
            metrics.recordBidRejected(RejectReason.ROOM_UNAVAILABLE.name());
            pending.complete(BidResult.rejected(productId, RejectReason.ROOM_UNAVAILABLE));
        }
        return pending.result;
    }

    private BidResult sequence(String bidderId, BigDecimal amount, PendingBid pending) {
        refreshLifecycle();
        BidResult result = sequencer.sequence(status, bidderId, amount);
        if (!result.accepted()) {
            metrics.recordBidRejected(result.reason().name());
            log.debug("[{}] Rejected bid {} from {}: {}", productId, amount, bidderId, result.reason());
            return result;
        }

        Bid bid = result.bid();
        metrics.recordBidAccepted(Duration.ofNanos(System.nanoTime() - pending.submittedAt));
        publish(RoomEvent.bidAccepted(productId, ++eventSeq, bid));
        record(bid);
        log.debug("[{}] Accepted bid #{} {} from {}", productId, bid.sequence(), bid.amount(), bidderId);
        return result;
    }

    private void record(Bid bid) {
        try {
            context.recorder().recordBid(productId, bid);
        } catch (RuntimeException e) {
            // The in-memory room is the source of truth; history is reconciled out of band
            metrics.recordRecorderFailure();
            log.warn("[{}] Bid recorder failed for bid #{}: {}", productId, bid.sequence(), e.toString());
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // LIFECYCLE
    // ═══════════════════════════════════════════════════════════════

    /**
     * Close the auction. Idempotent regardless of trigger: only the first close publishes
     * AUCTION_CLOSED.
     *
     * @return future completing with true if this call performed the transition
     */
    public CompletableFuture<Boolean> close(CloseReason reason) {
        CompletableFuture<Boolean> transitioned = new CompletableFuture<>();
        if (!mailbox.enqueueSystem(() -> transitioned.complete(doClose(reason)))) {
            transitioned.complete(false);
        }
        return transitioned;
    }

    /**
     * Current state, read through the serialization point.
     */
    public CompletableFuture<RoomSnapshot> snapshotAsync() {
        CompletableFuture<RoomSnapshot> result = new CompletableFuture<>();
        if (!mailbox.enqueueSystem(() -> result.complete(snapshot()))) {
            result.completeExceptionally(new RoomUnavailableException(productId, "Room has been reclaimed"));
        }
        return result;
    }

    private void refreshLifecycle() {
        if (status == AuctionStatus.CLOSED) {
            return;
        }
        AuctionStatus due = auction.statusAt(context.clock().instant());
        if (status == AuctionStatus.PENDING && due != AuctionStatus.PENDING) {
            doOpen();
        }
        if (status == AuctionStatus.OPEN && due == AuctionStatus.CLOSED) {
            doClose(CloseReason.EXPIRED);
        }
    }

    private boolean doOpen() {
        if (status != AuctionStatus.PENDING) {
            return false;
        }
        status = AuctionStatus.OPEN;
        publish(RoomEvent.opened(productId, ++eventSeq, sequencer.currentHighestAmount(), context.clock().instant()));
        log.info("[{}] Auction opened", productId);
        return true;
    }

    private boolean doClose(CloseReason reason) {
        if (status == AuctionStatus.CLOSED) {
            return false;
        }
        status = AuctionStatus.CLOSED;
        cancelTimers();
        Bid winner = sequencer.highest().orElse(null);
        publish(RoomEvent.closed(productId, ++eventSeq, winner, reason, context.clock().instant()));
        log.info("[{}] Auction closed ({}): winner={}, amount={}, bids={}",
            productId, reason,
            winner == null ? null : winner.bidderId(),
            winner == null ? null : winner.amount(),
            sequencer.lastSequence());
        if (references.get() == 0) {
            onReclaimable.accept(this);
        }
        return true;
    }

    private void publish(RoomEvent event) {
        List<Subscriber> overflowed = fanout.publish(event);
        metrics.recordEventPublished(event.type().name(), fanout.size());
        for (Subscriber subscriber : overflowed) {
            doDetach(subscriber.id(), DetachReason.SLOW_CONSUMER);
        }
    }

    private RoomSnapshot snapshot() {
        return new RoomSnapshot(
            productId,
            status,
            auction.basePrice(),
            auction.startTime(),
            auction.endTime(),
            sequencer.highest().orElse(null),
            sequencer.recent(),
            eventSeq,
            fanout.size(),
            context.clock().instant()
        );
    }

    private void cancelTimers() {
        ScheduledFuture<?> start = startTimer;
        if (start != null) {
            start.cancel(false);
        }
        ScheduledFuture<?> end = endTimer;
        if (end != null) {
            end.cancel(false);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // REFERENCE COUNTING (registry side)
    // ═══════════════════════════════════════════════════════════════

    private boolean retain() {
        while (true) {
            int current = references.get();
            if (current == RETIRED) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    private void releaseReference() {
        int remaining = references.decrementAndGet();
        if (remaining == 0 && status == AuctionStatus.CLOSED) {
            onReclaimable.accept(this);
        }
    }

    /**
     * Retire the room if it is CLOSED with no subscribers. Once retired it accepts no new
     * subscribers or work; in-flight tasks still drain.
     */
    boolean tryRetire() {
        if (status != AuctionStatus.CLOSED || !references.compareAndSet(0, RETIRED)) {
            return false;
        }
        cancelTimers();
        mailbox.close();
        return true;
    }

    /**
     * Detach everyone and stop accepting work. Used when the registry shuts down.
     */
    void shutdown() {
        mailbox.enqueueSystem(() -> {
            for (Subscriber subscriber : fanout.clear()) {
                subscriber.cancel();
                metrics.recordSubscriberDetached(DetachReason.SHUTDOWN.name());
            }
            references.set(RETIRED);
        });
        cancelTimers();
        mailbox.close();
    }

    /**
     * A bid waiting for the mailbox. Exactly one of sequencing and timeout claims it.
     */
    private final class PendingBid {
        private final CompletableFuture<BidResult> result = new CompletableFuture<>();
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final long submittedAt = System.nanoTime();
        private volatile ScheduledFuture<?> timeout;

        boolean claim() {
            return claimed.compareAndSet(false, true);
        }

        void complete(BidResult outcome) {
            ScheduledFuture<?> t = timeout;
            if (t != null) {
                t.cancel(false);
            }
            result.complete(outcome);
        }

        void expire() {
            if (!claim()) {
                return;
            }
            metrics.recordBidRejected(RejectReason.ROOM_UNAVAILABLE.name());
            log.warn("[{}] Bid not sequenced within {}ms, rejecting", productId,
                context.settings().submitTimeout().toMillis());
            result.complete(BidResult.rejected(productId, RejectReason.ROOM_UNAVAILABLE));
        }
    }
}

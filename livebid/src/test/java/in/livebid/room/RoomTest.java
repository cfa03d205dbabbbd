package in.livebid.room;

import in.livebid.application.port.output.BidRecorder;
import in.livebid.config.RoomSettings;
import in.livebid.domain.auction.Auction;
import in.livebid.domain.auction.AuctionStatus;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.bid.RejectReason;
import in.livebid.domain.event.CloseReason;
import in.livebid.domain.event.RoomEvent;
import in.livebid.domain.event.RoomEventType;
import in.livebid.infrastructure.catalog.InMemoryAuctionCatalog;
import in.livebid.infrastructure.metrics.AuctionMetrics;
import in.livebid.infrastructure.persistence.InMemoryBidRecorder;
import in.livebid.support.MutableClock;
import in.livebid.support.RecordingConnectionHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static in.livebid.support.RecordingConnectionHandle.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Room lifecycle and bidding")
class RoomTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String PRODUCT = "lot-1";

    private MutableClock clock;
    private InMemoryAuctionCatalog catalog;
    private InMemoryBidRecorder history;
    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        catalog = new InMemoryAuctionCatalog();
        history = new InMemoryBidRecorder();
        catalog.register(new Auction(PRODUCT, new BigDecimal("100"), T0.minusSeconds(60), T0.plus(Duration.ofHours(1))));
        registry = newRegistry(RoomSettings.defaults(), history);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private RoomRegistry newRegistry(RoomSettings settings, BidRecorder recorder) {
        return new RoomRegistry(catalog, RoomContext.create(settings, clock, recorder, AuctionMetrics.NOOP));
    }

    private static BigDecimal amount(String value) {
        return new BigDecimal(value);
    }

    private static int subscribers(Room room) {
        return room.snapshotAsync().join().subscriberCount();
    }

    @Test
    @DisplayName("Base price is accepted only for the first bid; equal bids are too low")
    void basePriceAndEqualBids() {
        Room room = registry.getOrCreateRoom(PRODUCT);

        BidResult low = room.submitBid("alice", amount("90"));
        assertTrue(low.rejectedFor(RejectReason.AMOUNT_TOO_LOW));
        assertNull(low.currentHighest(), "No highest bid yet");

        BidResult first = room.submitBid("alice", amount("100"));
        assertTrue(first.accepted());
        assertEquals(1, first.bid().sequence());
        assertEquals(T0, first.bid().acceptedAt());

        BidResult equal = room.submitBid("bob", amount("100"));
        assertTrue(equal.rejectedFor(RejectReason.AMOUNT_TOO_LOW));
        assertEquals(0, amount("100").compareTo(equal.currentHighest()));

        BidResult higher = room.submitBid("bob", amount("100.01"));
        assertTrue(higher.accepted());
        assertEquals(2, higher.bid().sequence());
    }

    @Test
    @DisplayName("Non-positive amounts are too low even with a zero base price")
    void nonPositiveAmountsRejected() {
        catalog.register(new Auction("free-lot", BigDecimal.ZERO, T0.minusSeconds(1), T0.plusSeconds(600)));
        Room room = registry.getOrCreateRoom("free-lot");

        assertTrue(room.submitBid("alice", BigDecimal.ZERO).rejectedFor(RejectReason.AMOUNT_TOO_LOW));
        assertTrue(room.submitBid("alice", amount("-5")).rejectedFor(RejectReason.AMOUNT_TOO_LOW));
        assertTrue(room.submitBid("alice", amount("0.01")).accepted());
    }

    @Test
    @DisplayName("Bids without a bidder identity are unauthorized")
    void missingBidderIsUnauthorized() {
        Room room = registry.getOrCreateRoom(PRODUCT);

        assertTrue(room.submitBid((String) null, amount("150")).rejectedFor(RejectReason.UNAUTHORIZED));
        assertTrue(room.submitBid(" ", amount("150")).rejectedFor(RejectReason.UNAUTHORIZED));
        assertNull(room.snapshotAsync().join().highestBid());
    }

    @Test
    @DisplayName("Snapshot is the first message and precedes later events")
    void snapshotFirstThenEvents() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle handle = new RecordingConnectionHandle("h1");

        RoomSnapshot snapshot = room.attach(handle, "alice").join();
        assertEquals(AuctionStatus.OPEN, snapshot.status());
        assertEquals(0, snapshot.lastEventSeq());

        room.submitBid("bob", amount("120"));
        handle.awaitMessages(2);

        assertSame(snapshot, handle.firstSnapshot());
        RoomEvent event = handle.events().get(0);
        assertEquals(RoomEventType.BID_ACCEPTED, event.type());
        assertEquals(1, event.seq());
        assertEquals("bob", event.bid().bidderId());
    }

    @Test
    @DisplayName("Late joiner sees the current highest bid and recent history")
    void lateJoinerSnapshot() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        room.submitBid("alice", amount("100"));
        room.submitBid("bob", amount("110"));

        RecordingConnectionHandle late = new RecordingConnectionHandle("late");
        RoomSnapshot snapshot = room.attach(late).join();

        assertEquals("bob", snapshot.highestBid().bidderId());
        assertEquals(0, amount("110").compareTo(snapshot.currentHighest()));
        assertEquals(2, snapshot.recentBids().size());
        assertEquals(2, snapshot.lastEventSeq());
        assertEquals(1, snapshot.subscriberCount());
    }

    @Test
    @DisplayName("End time elapsed: bids rejected, one AUCTION_CLOSED per subscriber")
    void expiredAuctionClosesOnce() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle a = new RecordingConnectionHandle("a");
        RecordingConnectionHandle b = new RecordingConnectionHandle("b");
        room.attach(a, "alice").join();
        room.attach(b, "bob").join();
        room.submitBid("alice", amount("150"));

        clock.advance(Duration.ofHours(2));

        BidResult late = room.submitBid("bob", amount("500"));
        assertTrue(late.rejectedFor(RejectReason.AUCTION_NOT_OPEN));
        assertEquals(AuctionStatus.CLOSED, room.status());

        assertFalse(room.close(CloseReason.ADMIN).join(), "Already closed");
        assertFalse(room.close(CloseReason.EXPIRED).join(), "Already closed");

        for (RecordingConnectionHandle handle : List.of(a, b)) {
            handle.awaitEvents(RoomEventType.AUCTION_CLOSED, 1);
            List<RoomEvent> closed = handle.events(RoomEventType.AUCTION_CLOSED);
            assertEquals(1, closed.size());
            assertEquals("alice", closed.get(0).bid().bidderId());
            assertEquals(CloseReason.EXPIRED, closed.get(0).closeReason());
        }
    }

    @Test
    @DisplayName("End timer closes the auction without any interaction")
    void endTimerCloses() {
        catalog.register(new Auction("short-lot", amount("10"), T0.minusSeconds(10), T0.plusMillis(150)));
        Room room = registry.getOrCreateRoom("short-lot");
        RecordingConnectionHandle handle = new RecordingConnectionHandle("watcher");
        room.attach(handle).join();

        handle.awaitEvents(RoomEventType.AUCTION_CLOSED, 1);
        assertEquals(AuctionStatus.CLOSED, room.status());
        assertNull(handle.events(RoomEventType.AUCTION_CLOSED).get(0).bid(), "No winner");
        assertTrue(room.submitBid("alice", amount("20")).rejectedFor(RejectReason.AUCTION_NOT_OPEN));
    }

    @Test
    @DisplayName("Pending auction opens at start time")
    void pendingOpensAtStart() {
        catalog.register(new Auction("future-lot", amount("50"), T0.plus(Duration.ofHours(1)), T0.plus(Duration.ofHours(2))));
        Room room = registry.getOrCreateRoom("future-lot");
        RecordingConnectionHandle handle = new RecordingConnectionHandle("early");

        assertEquals(AuctionStatus.PENDING, room.attach(handle, "alice").join().status());
        assertTrue(room.submitBid("alice", amount("60")).rejectedFor(RejectReason.AUCTION_NOT_OPEN));

        clock.advance(Duration.ofHours(1));
        BidResult accepted = room.submitBid("alice", amount("60"));
        assertTrue(accepted.accepted());
        assertEquals(AuctionStatus.OPEN, room.status());

        handle.awaitMessages(3);
        List<RoomEvent> events = handle.events();
        assertEquals(RoomEventType.AUCTION_OPENED, events.get(0).type());
        assertEquals(1, events.get(0).seq());
        assertEquals(RoomEventType.BID_ACCEPTED, events.get(1).type());
        assertEquals(2, events.get(1).seq());
    }

    @Test
    @DisplayName("Detach is idempotent and stops delivery")
    void detachIdempotent() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle stays = new RecordingConnectionHandle("stays");
        RecordingConnectionHandle leaves = new RecordingConnectionHandle("leaves");
        room.attach(stays).join();
        room.attach(leaves).join();

        room.detach(leaves);
        room.detach(leaves);
        assertEquals(1, subscribers(room));
        assertEquals(1, room.subscriberCount());

        room.submitBid("alice", amount("100"));
        stays.awaitEvents(RoomEventType.BID_ACCEPTED, 1);
        assertTrue(leaves.events().isEmpty());
        assertEquals(0, leaves.closeCount(), "Client detach leaves the channel to the transport");
    }

    @Test
    @DisplayName("Attaching the same handle twice keeps one membership")
    void duplicateAttach() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle handle = new RecordingConnectionHandle("dup");

        room.attach(handle).join();
        room.attach(handle).join();

        assertEquals(1, subscribers(room));
        assertEquals(1, room.subscriberCount());
        room.submitBid("alice", amount("100"));
        handle.awaitEvents(RoomEventType.BID_ACCEPTED, 1);
        assertEquals(1, handle.events(RoomEventType.BID_ACCEPTED).size());
    }

    @Test
    @DisplayName("Concurrent closes publish exactly one AUCTION_CLOSED")
    void concurrentCloseOnce() throws Exception {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle handle = new RecordingConnectionHandle("h");
        room.attach(handle).join();
        room.submitBid("alice", amount("130"));

        List<CompletableFuture<Boolean>> closes = new ArrayList<>();
        CountDownLatch go = new CountDownLatch(1);
        List<Thread> threads = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            CloseReason reason = i % 2 == 0 ? CloseReason.ADMIN : CloseReason.EXPIRED;
            CompletableFuture<Boolean> result = new CompletableFuture<>();
            closes.add(result);
            Thread t = new Thread(() -> {
                try {
                    go.await();
                    room.close(reason).whenComplete((r, e) -> result.complete(Boolean.TRUE.equals(r)));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads.add(t);
            t.start();
        }
        go.countDown();
        for (Thread t : threads) {
            t.join(5000);
        }

        long transitions = closes.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();
        assertEquals(1, transitions);
        handle.awaitEvents(RoomEventType.AUCTION_CLOSED, 1);
        Thread.sleep(50);
        assertEquals(1, handle.events(RoomEventType.AUCTION_CLOSED).size());
        assertEquals(0, amount("130").compareTo(handle.events(RoomEventType.AUCTION_CLOSED).get(0).currentHighest()));
    }

    @Test
    @DisplayName("Bid through a watch-only handle is unauthorized and the result is queued to it")
    void watchOnlyHandleBid() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle watcher = new RecordingConnectionHandle("watcher");
        room.attach(watcher).join();

        BidResult result = room.submitBid(watcher, amount("150"));

        assertTrue(result.rejectedFor(RejectReason.UNAUTHORIZED));
        awaitCondition(() -> watcher.results().size() == 1, Duration.ofSeconds(5), "bid result delivered");
        assertEquals(result, watcher.results().get(0));
    }

    @Test
    @DisplayName("Bid through a bidder handle uses the attached identity")
    void bidderHandleBid() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle bidder = new RecordingConnectionHandle("carol-conn");
        room.attach(bidder, "carol").join();

        BidResult result = room.submitBid(bidder, amount("175.50"));

        assertTrue(result.accepted());
        assertEquals("carol", result.bid().bidderId());
        bidder.awaitMessages(3);
        // Event first, then the submitter's own result
        assertEquals(RoomEventType.BID_ACCEPTED, bidder.events().get(0).type());
        assertTrue(bidder.messages().get(2) instanceof BidResult);
    }

    @Test
    @DisplayName("A handle whose send fails is detached and closed")
    void sendFailureDetaches() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle broken = RecordingConnectionHandle.failing("broken");
        room.attach(broken).join();

        awaitCondition(() -> broken.closeCount() == 1, Duration.ofSeconds(5), "broken handle closed");
        awaitCondition(() -> room.subscriberCount() == 0, Duration.ofSeconds(5), "broken handle detached");
        assertTrue(room.submitBid("alice", amount("100")).accepted());
    }

    @Test
    @DisplayName("Accepted bids are handed to the recorder; recorder failures do not reject bids")
    void recorderInteraction() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        room.submitBid("alice", amount("100"));
        room.submitBid("bob", amount("101"));
        assertEquals(2, history.history(PRODUCT).size());
        assertEquals("bob", history.history(PRODUCT).get(1).bidderId());

        RoomRegistry failing = newRegistry(RoomSettings.defaults(), (productId, bid) -> {
            throw new IllegalStateException("disk full");
        });
        try {
            BidResult result = failing.getOrCreateRoom(PRODUCT).submitBid("alice", amount("100"));
            assertTrue(result.accepted());
        } finally {
            failing.shutdown();
        }
    }

    @Test
    @DisplayName("A bid not sequenced within the submit timeout is rejected and never applied")
    void submitTimeout() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BidRecorder blocking = (productId, bid) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        RoomSettings settings = RoomSettings.defaults().withSubmitTimeout(Duration.ofMillis(100));
        RoomRegistry slow = newRegistry(settings, blocking);
        try {
            Room room = slow.getOrCreateRoom(PRODUCT);
            CompletableFuture<BidResult> first = room.submitBidAsync("alice", amount("100"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            BidResult second = room.submitBid("bob", amount("200"));
            assertTrue(second.rejectedFor(RejectReason.ROOM_UNAVAILABLE));

            release.countDown();
            assertTrue(first.get(5, TimeUnit.SECONDS).accepted());
            RoomSnapshot snapshot = room.snapshotAsync().get(5, TimeUnit.SECONDS);
            assertEquals("alice", snapshot.highestBid().bidderId());
            assertEquals(1, snapshot.recentBids().size());
        } finally {
            release.countDown();
            slow.shutdown();
        }
    }

    @Test
    @DisplayName("A full mailbox refuses bids immediately")
    void fullMailboxRefuses() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        BidRecorder blocking = (productId, bid) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };
        RoomSettings settings = RoomSettings.defaults().withMailboxCapacity(1);
        RoomRegistry saturated = newRegistry(settings, blocking);
        try {
            Room room = saturated.getOrCreateRoom(PRODUCT);
            room.submitBidAsync("alice", amount("100"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            CompletableFuture<BidResult> queued = room.submitBidAsync("bob", amount("110"));
            CompletableFuture<BidResult> refused = room.submitBidAsync("carol", amount("120"));

            assertTrue(refused.isDone(), "Refused without waiting");
            assertTrue(refused.join().rejectedFor(RejectReason.ROOM_UNAVAILABLE));

            release.countDown();
            assertTrue(queued.get(5, TimeUnit.SECONDS).accepted());
        } finally {
            release.countDown();
            saturated.shutdown();
        }
    }

    @Test
    @DisplayName("A sequenced bid leaves no submission timeout armed")
    void settledBidCancelsItsTimeout() {
        RoomContext context = RoomContext.create(
            RoomSettings.defaults().withSubmitTimeout(Duration.ofSeconds(30)), clock, history, AuctionMetrics.NOOP);
        RoomRegistry own = new RoomRegistry(catalog, context);
        try {
            Room room = own.getOrCreateRoom(PRODUCT);
            int lifecycleTimers = context.timer().scheduledCount();

            for (int i = 1; i <= 50; i++) {
                assertTrue(room.submitBid("alice", amount(String.valueOf(100 + i))).accepted());
                assertEquals(lifecycleTimers, context.timer().scheduledCount(), "after bid " + i);
            }
        } finally {
            own.shutdown();
        }
    }
}

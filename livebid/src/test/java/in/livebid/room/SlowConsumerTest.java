package in.livebid.room;

import in.livebid.config.RoomSettings;
import in.livebid.domain.auction.Auction;
import in.livebid.domain.event.RoomEventType;
import in.livebid.infrastructure.catalog.InMemoryAuctionCatalog;
import in.livebid.infrastructure.metrics.AuctionMetrics;
import in.livebid.infrastructure.persistence.InMemoryBidRecorder;
import in.livebid.support.MutableClock;
import in.livebid.support.RecordingConnectionHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static in.livebid.support.RecordingConnectionHandle.awaitCondition;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class SlowConsumerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
    private static final String PRODUCT = "lot-slow";

    @Mock
    private AuctionMetrics metrics;

    private RoomRegistry registry;

    @BeforeEach
    void setUp() {
        InMemoryAuctionCatalog catalog = new InMemoryAuctionCatalog();
        catalog.register(new Auction(PRODUCT, new BigDecimal("1"), T0.minusSeconds(60), T0.plus(Duration.ofHours(1))));
        // Enough delivery threads that the stalled send cannot starve the other subscriber
        RoomSettings settings = new RoomSettings(1024, 4, Duration.ofSeconds(2), 20, 2, 4, 1);
        registry = new RoomRegistry(catalog,
            RoomContext.create(settings, new MutableClock(T0), new InMemoryBidRecorder(), metrics));
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void stalledSubscriberIsEvictedWithoutDelayingOthers() {
        Room room = registry.getOrCreateRoom(PRODUCT);
        RecordingConnectionHandle slow = new RecordingConnectionHandle("slow").stalled();
        RecordingConnectionHandle fast = new RecordingConnectionHandle("fast");
        room.attach(slow).join();
        room.attach(fast).join();

        try {
            for (int i = 1; i <= 10; i++) {
                assertTrue(room.submitBid("alice", BigDecimal.valueOf(i)).accepted());
                fast.awaitEvents(RoomEventType.BID_ACCEPTED, i);
            }

            fast.awaitEvents(RoomEventType.BID_ACCEPTED, 10);
            awaitCondition(() -> slow.closeCount() == 1, Duration.ofSeconds(5), "slow consumer closed");
            awaitCondition(() -> room.subscriberCount() == 1, Duration.ofSeconds(5), "slow consumer detached");
            verify(metrics, timeout(5000)).recordSubscriberDetached(DetachReason.SLOW_CONSUMER.name());
        } finally {
            slow.release();
        }

        assertTrue(room.submitBid("alice", BigDecimal.valueOf(11)).accepted());
        fast.awaitEvents(RoomEventType.BID_ACCEPTED, 11);
        assertTrue(slow.events().size() < 11, "Evicted subscriber receives nothing further");
        verify(metrics, never()).recordSubscriberDetached(DetachReason.SEND_FAILED.name());
        verify(metrics, atLeast(11)).recordBidAccepted(any(Duration.class));
        verify(metrics, atLeast(1)).recordEventPublished(anyString(), anyInt());
    }
}

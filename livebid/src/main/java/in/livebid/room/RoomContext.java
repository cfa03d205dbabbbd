package in.livebid.room;

import in.livebid.application.port.output.BidRecorder;
import in.livebid.config.RoomSettings;
import in.livebid.infrastructure.metrics.AuctionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Infrastructure shared by every room: the mailbox dispatcher, the subscriber delivery pool,
 * the auction timer and the collaborators.
 *
 * Rooms never share state through this object; it only hands out threads and collaborators.
 */
public final class RoomContext {
    private static final Logger log = LoggerFactory.getLogger(RoomContext.class);

    private final RoomSettings settings;
    private final Clock clock;
    private final ExecutorService dispatcher;
    private final ExecutorService delivery;
    private final AuctionTimer timer;
    private final BidRecorder recorder;
    private final AuctionMetrics metrics;

    private RoomContext(RoomSettings settings, Clock clock, ExecutorService dispatcher, ExecutorService delivery,
                        AuctionTimer timer, BidRecorder recorder, AuctionMetrics metrics) {
        this.settings = settings;
        this.clock = clock;
        this.dispatcher = dispatcher;
        this.delivery = delivery;
        this.timer = timer;
        this.recorder = recorder;
        this.metrics = metrics;
    }

    public static RoomContext create(RoomSettings settings, Clock clock, BidRecorder recorder, AuctionMetrics metrics) {
        ExecutorService dispatcher = Executors.newFixedThreadPool(settings.dispatcherThreads(), named("room-dispatcher"));
        ExecutorService delivery = Executors.newFixedThreadPool(settings.deliveryThreads(), named("room-delivery"));
        log.info("RoomContext initialized: {} dispatcher threads, {} delivery threads, mailbox={}, subscriberQueue={}",
            settings.dispatcherThreads(), settings.deliveryThreads(),
            settings.mailboxCapacity(), settings.subscriberQueueCapacity());
        return new RoomContext(settings, clock, dispatcher, delivery, new AuctionTimer(clock), recorder, metrics);
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public RoomSettings settings() {
        return settings;
    }

    public Clock clock() {
        return clock;
    }

    ExecutorService dispatcher() {
        return dispatcher;
    }

    ExecutorService delivery() {
        return delivery;
    }

    AuctionTimer timer() {
        return timer;
    }

    BidRecorder recorder() {
        return recorder;
    }

    public AuctionMetrics metrics() {
        return metrics;
    }

    /**
     * Stop timers and drain the pools. Waits up to 5 seconds per pool.
     */
    public void shutdown() {
        timer.shutdown();
        dispatcher.shutdown();
        delivery.shutdown();
        try {
            if (!dispatcher.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Room dispatcher did not terminate in time, forcing shutdown");
                dispatcher.shutdownNow();
            }
            if (!delivery.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Delivery pool did not terminate in time, forcing shutdown");
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("RoomContext shutdown interrupted", e);
            dispatcher.shutdownNow();
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("RoomContext shutdown complete");
    }
}

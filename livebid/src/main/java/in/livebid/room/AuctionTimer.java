package in.livebid.room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fires room lifecycle transitions at auction start/end instants, and bounds bid submissions.
 *
 * Timer tasks never touch room state directly; they only enqueue into the room's mailbox.
 */
public final class AuctionTimer {
    private static final Logger log = LoggerFactory.getLogger(AuctionTimer.class);

    private final Clock clock;
    private final ScheduledThreadPoolExecutor scheduler;

    public AuctionTimer(Clock clock) {
        this.clock = clock;
        this.scheduler = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "auction-timer");
            t.setDaemon(true);
            return t;
        });
        // Cancelled submission timeouts would otherwise pile up in the queue
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    /**
     * Run the task at the given instant (immediately if it is already past).
     */
    public ScheduledFuture<?> scheduleAt(Instant at, Runnable task) {
        long delayMs = Math.max(0, Duration.between(clock.instant(), at).toMillis());
        return scheduler.schedule(guarded(task), delayMs, TimeUnit.MILLISECONDS);
    }

    public ScheduledFuture<?> scheduleAfter(Duration delay, Runnable task) {
        return scheduler.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Tasks still waiting to fire. Cancelled tasks are removed immediately.
     */
    int scheduledCount() {
        return scheduler.getQueue().size();
    }

    public void shutdown() {
        scheduler.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Auction timer task failed", e);
            }
        };
    }
}

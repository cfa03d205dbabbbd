package in.livebid.application.service;

import in.livebid.application.port.output.BidRecorder;
import in.livebid.domain.auction.Bid;
import in.livebid.infrastructure.metrics.AuctionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Write-behind decorator for a bid recorder.
 *
 * Rooms call {@link #recordBid} on their serialization point; this hands the write to a small
 * bounded pool and returns immediately. Failures are logged here and never reach the room or
 * the bidder.
 */
public final class AsyncBidRecorder implements BidRecorder {
    private static final Logger log = LoggerFactory.getLogger(AsyncBidRecorder.class);

    private static final int QUEUE_CAPACITY = 100_000;

    private final BidRecorder delegate;
    private final AuctionMetrics metrics;
    private final ThreadPoolExecutor executor;

    public AsyncBidRecorder(BidRecorder delegate, int threads, AuctionMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
        AtomicInteger counter = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(QUEUE_CAPACITY),
            r -> {
                Thread t = new Thread(r, "bid-recorder-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
    }

    @Override
    public void recordBid(String productId, Bid bid) {
        try {
            executor.execute(() -> write(productId, bid));
        } catch (RejectedExecutionException e) {
            metrics.recordRecorderFailure();
            log.warn("[{}] Bid recorder saturated, bid #{} not persisted", productId, bid.sequence());
        }
    }

    private void write(String productId, Bid bid) {
        try {
            delegate.recordBid(productId, bid);
        } catch (RuntimeException e) {
            metrics.recordRecorderFailure();
            log.error("[{}] Failed to record bid #{} ({} by {}): {}",
                productId, bid.sequence(), bid.amount(), bid.bidderId(), e.getMessage(), e);
        }
    }

    public int pending() {
        return executor.getQueue().size();
    }

    /**
     * Flush queued writes, waiting up to 10 seconds.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Bid recorder did not drain in time, {} writes dropped", executor.getQueue().size());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Bid recorder shutdown interrupted", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}

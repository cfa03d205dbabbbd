package in.livebid.infrastructure.metrics;

import java.time.Duration;

/**
 * Auction engine metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or anything else; {@link #NOOP} discards everything.
 */
public interface AuctionMetrics {

    /**
     * Record creation of a room.
     */
    void recordRoomCreated();

    /**
     * Record removal of a closed, empty room from the registry.
     */
    void recordRoomReclaimed();

    void recordSubscriberAttached();

    /**
     * Record a subscriber leaving a room.
     *
     * @param reason CLIENT, SLOW_CONSUMER, SEND_FAILED or SHUTDOWN
     */
    void recordSubscriberDetached(String reason);

    /**
     * Record an accepted bid.
     *
     * @param latency Time from submission to sequencing
     */
    void recordBidAccepted(Duration latency);

    /**
     * Record a rejected bid.
     *
     * @param reason Reject reason name
     */
    void recordBidRejected(String reason);

    /**
     * Record a broadcast event.
     *
     * @param eventType Event type name
     * @param subscribers Number of subscribers it was queued to
     */
    void recordEventPublished(String eventType, int subscribers);

    /**
     * Record a failure reported by the persistence collaborator.
     */
    void recordRecorderFailure();

    AuctionMetrics NOOP = new AuctionMetrics() {
        @Override public void recordRoomCreated() {}
        @Override public void recordRoomReclaimed() {}
        @Override public void recordSubscriberAttached() {}
        @Override public void recordSubscriberDetached(String reason) {}
        @Override public void recordBidAccepted(Duration latency) {}
        @Override public void recordBidRejected(String reason) {}
        @Override public void recordEventPublished(String eventType, int subscribers) {}
        @Override public void recordRecorderFailure() {}
    };
}

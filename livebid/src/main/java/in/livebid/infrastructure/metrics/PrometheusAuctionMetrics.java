package in.livebid.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of AuctionMetrics.
 *
 * Key Metrics:
 * - auction_rooms_active - Rooms currently held by the registry
 * - auction_subscribers_active - Attached subscribers across all rooms
 * - auction_subscriber_detaches_total{reason} - Detaches (client, slow consumer, send failure)
 * - auction_bids_total{outcome, reason} - Accepted and rejected bids
 * - auction_bid_sequencing_seconds - Submission to sequencing latency
 * - auction_events_published_total{type} - Broadcast events
 * - auction_event_deliveries_total{type} - Events queued to subscribers (fan-out width)
 * - auction_recorder_failures_total - Persistence collaborator failures
 */
public class PrometheusAuctionMetrics implements AuctionMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusAuctionMetrics.class);

    public static final String FAMILY_PREFIX = "auction_";

    private final CollectorRegistry registry;

    private final Gauge activeRooms;
    private final Counter roomsCreated;
    private final Gauge activeSubscribers;
    private final Counter detachCounter;
    private final Counter bidCounter;
    private final Histogram sequencingLatency;
    private final Counter eventCounter;
    private final Counter deliveryCounter;
    private final Counter recorderFailures;

    public PrometheusAuctionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusAuctionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.activeRooms = Gauge.build()
            .name("auction_rooms_active")
            .help("Auction rooms currently held by the registry")
            .register(registry);

        this.roomsCreated = Counter.build()
            .name("auction_rooms_created_total")
            .help("Total number of auction rooms created")
            .register(registry);

        this.activeSubscribers = Gauge.build()
            .name("auction_subscribers_active")
            .help("Subscribers attached across all rooms")
            .register(registry);

        this.detachCounter = Counter.build()
            .name("auction_subscriber_detaches_total")
            .help("Total number of subscriber detaches")
            .labelNames("reason")
            .register(registry);

        this.bidCounter = Counter.build()
            .name("auction_bids_total")
            .help("Total number of bid submissions")
            .labelNames("outcome", "reason")
            .register(registry);

        this.sequencingLatency = Histogram.build()
            .name("auction_bid_sequencing_seconds")
            .help("Latency from bid submission to sequencing in seconds")
            .buckets(0.0005, 0.001, 0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 2.0)
            .register(registry);

        this.eventCounter = Counter.build()
            .name("auction_events_published_total")
            .help("Total number of room events published")
            .labelNames("type")
            .register(registry);

        this.deliveryCounter = Counter.build()
            .name("auction_event_deliveries_total")
            .help("Total number of room events queued to subscribers")
            .labelNames("type")
            .register(registry);

        this.recorderFailures = Counter.build()
            .name("auction_recorder_failures_total")
            .help("Total number of failures reported by the bid recorder")
            .register(registry);

        log.info("[PrometheusAuctionMetrics] Metrics registered");
    }

    @Override
    public void recordRoomCreated() {
        roomsCreated.inc();
        activeRooms.inc();
    }

    @Override
    public void recordRoomReclaimed() {
        activeRooms.dec();
    }

    @Override
    public void recordSubscriberAttached() {
        activeSubscribers.inc();
    }

    @Override
    public void recordSubscriberDetached(String reason) {
        activeSubscribers.dec();
        detachCounter.labels(reason).inc();
    }

    @Override
    public void recordBidAccepted(Duration latency) {
        bidCounter.labels("accepted", "").inc();
        sequencingLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordBidRejected(String reason) {
        bidCounter.labels("rejected", reason).inc();
    }

    @Override
    public void recordEventPublished(String eventType, int subscribers) {
        eventCounter.labels(eventType).inc();
        deliveryCounter.labels(eventType).inc(subscribers);
    }

    @Override
    public void recordRecorderFailure() {
        recorderFailures.inc();
    }

    /**
     * Get Prometheus registry for the /metrics endpoint.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}

package in.livebid.config;

import in.livebid.util.Env;

import java.time.Duration;

/**
 * Tuning knobs for auction rooms.
 *
 * @param mailboxCapacity         client-originated tasks (attach, bid) a room may have queued
 * @param subscriberQueueCapacity outbound messages buffered per subscriber before eviction
 * @param submitTimeout           upper bound a bid submission waits to be sequenced
 * @param recentBids              accepted bids kept in the snapshot tail for late joiners
 * @param dispatcherThreads       threads draining room mailboxes
 * @param deliveryThreads         threads draining subscriber queues
 * @param recorderThreads         threads running the persistence collaborator
 */
public record RoomSettings(
    int mailboxCapacity,
    int subscriberQueueCapacity,
    Duration submitTimeout,
    int recentBids,
    int dispatcherThreads,
    int deliveryThreads,
    int recorderThreads
) {
    public static final int DEFAULT_MAILBOX_CAPACITY = 1024;
    public static final int DEFAULT_SUBSCRIBER_QUEUE_CAPACITY = 256;
    public static final long DEFAULT_SUBMIT_TIMEOUT_MS = 2000;
    public static final int DEFAULT_RECENT_BIDS = 20;

    public RoomSettings {
        if (mailboxCapacity <= 0) {
            throw new IllegalArgumentException("mailboxCapacity must be positive: " + mailboxCapacity);
        }
        if (subscriberQueueCapacity <= 0) {
            throw new IllegalArgumentException("subscriberQueueCapacity must be positive: " + subscriberQueueCapacity);
        }
        if (submitTimeout == null || submitTimeout.isNegative() || submitTimeout.isZero()) {
            throw new IllegalArgumentException("submitTimeout must be positive: " + submitTimeout);
        }
        if (recentBids < 0) {
            throw new IllegalArgumentException("recentBids must not be negative: " + recentBids);
        }
        if (dispatcherThreads <= 0 || deliveryThreads <= 0 || recorderThreads <= 0) {
            throw new IllegalArgumentException("Thread counts must be positive");
        }
    }

    public static RoomSettings defaults() {
        int cpus = Runtime.getRuntime().availableProcessors();
        return new RoomSettings(
            DEFAULT_MAILBOX_CAPACITY,
            DEFAULT_SUBSCRIBER_QUEUE_CAPACITY,
            Duration.ofMillis(DEFAULT_SUBMIT_TIMEOUT_MS),
            DEFAULT_RECENT_BIDS,
            cpus,
            cpus,
            2
        );
    }

    public static RoomSettings fromEnv() {
        RoomSettings d = defaults();
        return new RoomSettings(
            Env.getInt("ROOM_MAILBOX_CAPACITY", d.mailboxCapacity()),
            Env.getInt("SUBSCRIBER_QUEUE_CAPACITY", d.subscriberQueueCapacity()),
            Env.getMillis("BID_SUBMIT_TIMEOUT_MS", d.submitTimeout().toMillis()),
            Env.getInt("RECENT_BIDS", d.recentBids()),
            Env.getInt("ROOM_DISPATCHER_THREADS", d.dispatcherThreads()),
            Env.getInt("DELIVERY_THREADS", d.deliveryThreads()),
            Env.getInt("RECORDER_THREADS", d.recorderThreads())
        );
    }

    public RoomSettings withSubscriberQueueCapacity(int capacity) {
        return new RoomSettings(mailboxCapacity, capacity, submitTimeout, recentBids,
                                dispatcherThreads, deliveryThreads, recorderThreads);
    }

    public RoomSettings withMailboxCapacity(int capacity) {
        return new RoomSettings(capacity, subscriberQueueCapacity, submitTimeout, recentBids,
                                dispatcherThreads, deliveryThreads, recorderThreads);
    }

    public RoomSettings withSubmitTimeout(Duration timeout) {
        return new RoomSettings(mailboxCapacity, subscriberQueueCapacity, timeout, recentBids,
                                dispatcherThreads, deliveryThreads, recorderThreads);
    }
}

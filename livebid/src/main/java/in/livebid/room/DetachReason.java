package in.livebid.room;

/**
 * Why a subscriber left a room.
 */
public enum DetachReason {
    /** Client disconnect or explicit leave. */
    CLIENT,
    /** Outbound queue overflowed; the subscriber could not keep up. */
    SLOW_CONSUMER,
    /** The transport reported a send failure. */
    SEND_FAILED,
    /** Room or registry shutdown. */
    SHUTDOWN
}

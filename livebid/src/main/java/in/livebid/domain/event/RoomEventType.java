package in.livebid.domain.event;

/**
 * Events broadcast to every subscriber of a room.
 */
public enum RoomEventType {
    BID_ACCEPTED,
    AUCTION_OPENED,
    AUCTION_CLOSED
}

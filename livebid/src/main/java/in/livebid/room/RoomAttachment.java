package in.livebid.room;

import java.util.concurrent.CompletableFuture;

/**
 * A subscriber's membership in a room: the room it joined and the snapshot it was given.
 */
public record RoomAttachment(Room room, CompletableFuture<RoomSnapshot> snapshot) {
}

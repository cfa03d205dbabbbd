package in.livebid.room;

import in.livebid.application.port.output.AuctionCatalog;
import in.livebid.application.port.output.ConnectionHandle;
import in.livebid.domain.auction.Auction;
import in.livebid.domain.event.CloseReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide map of product id → live room.
 *
 * At most one live room exists per product id. Creation and removal both go through
 * {@link ConcurrentMap#compute}, so concurrent first-time callers observe the same instance and
 * a room is only removed once it is CLOSED with no subscribers. A caller that races with the
 * removal of a just-retired room gets a fresh instance, never the stale one.
 */
public final class RoomRegistry {
    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private static final int MAX_ATTACH_ATTEMPTS = 8;

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    // Products closed by an administrator; rooms recreated for them start CLOSED
    private final Set<String> closedByAdmin = ConcurrentHashMap.newKeySet();
    private final AuctionCatalog catalog;
    private final RoomContext context;

    public RoomRegistry(AuctionCatalog catalog, RoomContext context) {
        this.catalog = catalog;
        this.context = context;
    }

    /**
     * Get the live room for a product, creating it on first use.
     *
     * The catalog is consulted only when a room is created. A room created for an auction that
     * has already ended (or was closed by an administrator) starts CLOSED with no subscribers;
     * it stays registered until the caller attaches and detaches, or calls
     * {@link #releaseIfEmpty(String)}. {@link #attach} and {@link #closeAuction} handle this.
     *
     * @throws AuctionNotFoundException if the catalog does not know the product
     */
    public Room getOrCreateRoom(String productId) {
        return rooms.compute(productId, (id, existing) -> {
            if (existing != null && !existing.isRetired()) {
                return existing;
            }
            return createRoom(id);
        });
    }

    /**
     * Attach a connection to the product's room, creating the room if needed.
     *
     * @param bidderId Authenticated bidder, or null for a watch-only connection
     * @throws AuctionNotFoundException if the catalog does not know the product
     * @throws RoomUnavailableException if the room kept being reclaimed underneath us
     */
    public RoomAttachment attach(String productId, ConnectionHandle handle, String bidderId) {
        for (int attempt = 1; attempt <= MAX_ATTACH_ATTEMPTS; attempt++) {
            Room room = getOrCreateRoom(productId);
            var snapshot = room.tryAttach(handle, bidderId);
            if (snapshot != null) {
                return new RoomAttachment(room, snapshot);
            }
            rooms.remove(productId, room);
            log.debug("[{}] Room retired during attach, retrying (attempt {})", productId, attempt);
        }
        throw new RoomUnavailableException(productId, "Room kept retiring during attach");
    }

    /**
     * Remove the product's room if it is CLOSED and has no subscribers; otherwise no-op.
     *
     * @return true if a room was removed
     */
    public boolean releaseIfEmpty(String productId) {
        AtomicReference<Room> released = new AtomicReference<>();
        rooms.computeIfPresent(productId, (id, room) -> {
            if (room.tryRetire()) {
                released.set(room);
                return null;
            }
            return room;
        });

        Room room = released.get();
        if (room == null) {
            return false;
        }
        context.metrics().recordRoomReclaimed();
        log.info("[{}] Room reclaimed (rooms={})", productId, rooms.size());
        return true;
    }

    /**
     * Administratively close a product's auction, creating its room if needed so that current
     * and future subscribers observe it as CLOSED.
     *
     * @return future completing with true if this call closed the auction
     * @throws AuctionNotFoundException if the catalog does not know the product
     */
    public CompletableFuture<Boolean> closeAuction(String productId) {
        Room room = getOrCreateRoom(productId);
        if (closedByAdmin.add(productId)) {
            log.info("[{}] Administrative close requested", productId);
        }
        return room.close(CloseReason.ADMIN)
            .whenComplete((closed, error) -> releaseIfEmpty(productId));
    }

    public Optional<Room> find(String productId) {
        Room room = rooms.get(productId);
        return room == null || room.isRetired() ? Optional.empty() : Optional.of(room);
    }

    public int roomCount() {
        return rooms.size();
    }

    /**
     * Total subscribers across all rooms.
     */
    public int subscriberCount() {
        return rooms.values().stream().mapToInt(Room::subscriberCount).sum();
    }

    /**
     * Detach everyone, drop all rooms and stop the shared pools.
     */
    public void shutdown() {
        log.info("Shutting down RoomRegistry with {} rooms", rooms.size());
        rooms.values().forEach(Room::shutdown);
        rooms.clear();
        context.shutdown();
    }

    // Runs inside compute(): the catalog lookup holds this product's bin lock, so catalogs must
    // answer from memory. A remote catalog needs a cache in front of it.
    private Room createRoom(String productId) {
        Auction auction = catalog.fetchAuction(productId)
            .orElseThrow(() -> new AuctionNotFoundException(productId));
        Room room = new Room(auction, context, r -> releaseIfEmpty(r.productId()), closedByAdmin.contains(productId));
        room.armTimers();
        context.metrics().recordRoomCreated();
        return room;
    }
}

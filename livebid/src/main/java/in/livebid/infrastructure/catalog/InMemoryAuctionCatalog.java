package in.livebid.infrastructure.catalog;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.livebid.application.port.output.AuctionCatalog;
import in.livebid.domain.auction.Auction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Auction catalog held in memory, optionally seeded from a JSON file.
 *
 * File format:
 * <pre>
 * [
 *   {"productId": "lot-1", "basePrice": "100.00",
 *    "startTime": "2024-05-01T10:00:00Z", "endTime": "2024-05-01T11:00:00Z"}
 * ]
 * </pre>
 */
public final class InMemoryAuctionCatalog implements AuctionCatalog {
    private static final Logger log = LoggerFactory.getLogger(InMemoryAuctionCatalog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final ConcurrentMap<String, Auction> auctions = new ConcurrentHashMap<>();

    /**
     * Register or replace an auction. Rooms already live keep the metadata they were created with.
     */
    public void register(Auction auction) {
        Auction previous = auctions.put(auction.productId(), auction);
        if (previous != null) {
            log.info("[{}] Auction metadata replaced", auction.productId());
        }
    }

    @Override
    public Optional<Auction> fetchAuction(String productId) {
        if (productId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(auctions.get(productId));
    }

    public int size() {
        return auctions.size();
    }

    /**
     * Load auctions from a JSON array file.
     *
     * @return number of auctions loaded
     * @throws IOException if the file cannot be read or an entry is invalid
     */
    public int loadFromJson(Path file) throws IOException {
        JsonNode root = MAPPER.readTree(Files.readString(file));
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of auctions in " + file);
        }

        int loaded = 0;
        for (JsonNode entry : root) {
            register(parseAuction(entry, file));
            loaded++;
        }
        log.info("Loaded {} auctions from {}", loaded, file);
        return loaded;
    }

    private static Auction parseAuction(JsonNode entry, Path file) throws IOException {
        String productId = text(entry, "productId", file);
        try {
            return new Auction(
                productId,
                new BigDecimal(text(entry, "basePrice", file)),
                Instant.parse(text(entry, "startTime", file)),
                Instant.parse(text(entry, "endTime", file))
            );
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IOException("Invalid auction '" + productId + "' in " + file + ": " + e.getMessage(), e);
        }
    }

    private static String text(JsonNode entry, String field, Path file) throws IOException {
        JsonNode node = entry.get(field);
        if (node == null || node.isNull()) {
            throw new IOException("Missing '" + field + "' in auction entry of " + file);
        }
        return node.asText().trim();
    }
}

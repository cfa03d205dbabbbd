package in.livebid.infrastructure.catalog;

import in.livebid.domain.auction.Auction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryAuctionCatalogTest {

    private InMemoryAuctionCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new InMemoryAuctionCatalog();
    }

    private static Path fixture(String name) throws URISyntaxException {
        return Path.of(InMemoryAuctionCatalogTest.class.getResource("/catalog/" + name).toURI());
    }

    @Test
    void registerAndFetch() {
        Auction auction = new Auction("lot-1", BigDecimal.TEN,
            Instant.parse("2024-05-01T10:00:00Z"), Instant.parse("2024-05-01T11:00:00Z"));
        catalog.register(auction);

        assertEquals(auction, catalog.fetchAuction("lot-1").orElseThrow());
        assertTrue(catalog.fetchAuction("lot-2").isEmpty());
        assertTrue(catalog.fetchAuction(null).isEmpty());
    }

    @Test
    void loadsAuctionsFromJson() throws Exception {
        assertEquals(2, catalog.loadFromJson(fixture("auctions.json")));

        Auction first = catalog.fetchAuction("lot-100").orElseThrow();
        assertEquals(new BigDecimal("100.00"), first.basePrice());
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), first.startTime());
        assertEquals(Instant.parse("2024-05-01T11:00:00Z"), first.endTime());

        Auction second = catalog.fetchAuction("lot-200").orElseThrow();
        assertEquals(0, new BigDecimal("250.5").compareTo(second.basePrice()));
    }

    @Test
    void invalidWindowFailsTheLoad() {
        IOException e = assertThrows(IOException.class, () -> catalog.loadFromJson(fixture("invalid-window.json")));
        assertTrue(e.getMessage().contains("lot-bad"));
    }

    @Test
    void missingFieldAndNonArrayFail(@TempDir Path dir) throws IOException {
        Path missing = dir.resolve("missing.json");
        Files.writeString(missing, "[{\"productId\":\"x\",\"basePrice\":\"1\",\"startTime\":\"2024-05-01T10:00:00Z\"}]");
        assertThrows(IOException.class, () -> catalog.loadFromJson(missing));

        Path object = dir.resolve("object.json");
        Files.writeString(object, "{\"productId\":\"x\"}");
        assertThrows(IOException.class, () -> catalog.loadFromJson(object));
        assertEquals(0, catalog.size());
    }
}

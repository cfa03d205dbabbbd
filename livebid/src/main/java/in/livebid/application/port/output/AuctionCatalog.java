package in.livebid.application.port.output;

import in.livebid.domain.auction.Auction;

import java.util.Optional;

/**
 * Read-only source of auction metadata (base price and time window).
 * Consulted once per room creation.
 */
public interface AuctionCatalog {
    Optional<Auction> fetchAuction(String productId);
}

package in.livebid.infrastructure.persistence;

import in.livebid.application.port.output.BidRecorder;
import in.livebid.domain.auction.Bid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Append-only bid history kept in memory, per product.
 *
 * Writes may arrive out of order when recorded asynchronously; reads return bids ordered by
 * sequence.
 */
public final class InMemoryBidRecorder implements BidRecorder {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBidRecorder.class);

    private final ConcurrentMap<String, List<Bid>> history = new ConcurrentHashMap<>();

    @Override
    public void recordBid(String productId, Bid bid) {
        List<Bid> bids = history.computeIfAbsent(productId, k -> new ArrayList<>());
        synchronized (bids) {
            bids.add(bid);
        }
        log.debug("[{}] Recorded bid #{} {} by {}", productId, bid.sequence(), bid.amount(), bid.bidderId());
    }

    /**
     * Recorded bids for a product, by ascending sequence.
     */
    public List<Bid> history(String productId) {
        List<Bid> bids = history.get(productId);
        if (bids == null) {
            return List.of();
        }
        List<Bid> copy;
        synchronized (bids) {
            copy = new ArrayList<>(bids);
        }
        copy.sort(Comparator.comparingLong(Bid::sequence));
        return List.copyOf(copy);
    }

    public int totalRecorded() {
        int total = 0;
        for (List<Bid> bids : history.values()) {
            synchronized (bids) {
                total += bids.size();
            }
        }
        return total;
    }
}

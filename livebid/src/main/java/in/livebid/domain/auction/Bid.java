package in.livebid.domain.auction;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An accepted bid. Sequence and timestamp are assigned by the room, never by the client.
 */
public record Bid(
    long sequence,
    String bidderId,
    BigDecimal amount,
    Instant acceptedAt
) {
}

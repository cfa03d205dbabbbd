package in.livebid.domain.bid;

import java.math.BigDecimal;

/**
 * Parsed inbound client message.
 */
public record BidRequest(
    Action action,
    BigDecimal amount,   // BID only
    String nonce         // PING only
) {
    public enum Action {
        BID,
        PING
    }

    public static BidRequest bid(BigDecimal amount) {
        return new BidRequest(Action.BID, amount, null);
    }

    public static BidRequest ping(String nonce) {
        return new BidRequest(Action.PING, null, nonce);
    }
}

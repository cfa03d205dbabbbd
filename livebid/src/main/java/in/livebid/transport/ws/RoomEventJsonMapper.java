package in.livebid.transport.ws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.livebid.domain.auction.Bid;
import in.livebid.domain.bid.BidResult;
import in.livebid.domain.event.OutboundMessage;
import in.livebid.domain.event.RoomEvent;
import in.livebid.domain.event.SessionNotice;
import in.livebid.room.RoomSnapshot;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JSON wire format for outbound messages.
 *
 * Envelope: {@code {"type": ..., "productId": ..., "seq": ..., "payload": {...}, "ts": ...}}.
 * {@code seq} is the room event sequence (the snapshot's last sequence for SNAPSHOT) and is
 * omitted for connection-level messages. Amounts are plain decimal strings.
 */
public final class RoomEventJsonMapper {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String toJson(OutboundMessage message) {
        try {
            return MAPPER.writeValueAsString(toNode(message));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + message.getClass().getSimpleName(), e);
        }
    }

    public ObjectNode toNode(OutboundMessage message) {
        if (message instanceof RoomEvent) {
            return eventToJson((RoomEvent) message);
        }
        if (message instanceof RoomSnapshot) {
            return snapshotToJson((RoomSnapshot) message);
        }
        if (message instanceof BidResult) {
            return resultToJson((BidResult) message);
        }
        if (message instanceof SessionNotice) {
            return noticeToJson((SessionNotice) message);
        }
        throw new IllegalArgumentException("Unsupported message: " + message.getClass().getName());
    }

    private ObjectNode eventToJson(RoomEvent e) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("status", e.status().name());
        if (e.bid() != null) {
            payload.set(e.closeReason() == null ? "bid" : "winningBid", bidToJson(e.bid()));
        }
        putAmount(payload, "currentHighest", e.currentHighest());
        if (e.closeReason() != null) {
            payload.put("closeReason", e.closeReason().name());
        }
        ObjectNode envelope = envelope(e.type().name(), e.productId(), e.ts(), payload);
        envelope.put("seq", e.seq());
        return envelope;
    }

    private ObjectNode snapshotToJson(RoomSnapshot s) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("status", s.status().name());
        putAmount(payload, "basePrice", s.basePrice());
        payload.put("startTime", s.startTime().toString());
        payload.put("endTime", s.endTime().toString());
        if (s.highestBid() != null) {
            payload.set("highestBid", bidToJson(s.highestBid()));
        }
        putAmount(payload, "currentHighest", s.currentHighest());
        ArrayNode recent = payload.putArray("recentBids");
        for (Bid bid : s.recentBids()) {
            recent.add(bidToJson(bid));
        }
        payload.put("subscribers", s.subscriberCount());
        ObjectNode envelope = envelope("SNAPSHOT", s.productId(), s.ts(), payload);
        envelope.put("seq", s.lastEventSeq());
        return envelope;
    }

    private ObjectNode resultToJson(BidResult r) {
        ObjectNode payload = MAPPER.createObjectNode();
        payload.put("accepted", r.accepted());
        if (r.bid() != null) {
            payload.set("bid", bidToJson(r.bid()));
        }
        if (r.reason() != null) {
            payload.put("reason", r.reason().name());
            payload.put("message", r.reason().getDescription());
        }
        putAmount(payload, "currentHighest", r.currentHighest());
        return envelope("BID_RESULT", r.productId(), Instant.now(), payload);
    }

    private ObjectNode noticeToJson(SessionNotice n) {
        ObjectNode payload = MAPPER.createObjectNode();
        switch (n.kind()) {
            case PONG -> {
                payload.put("nonce", n.nonce() == null ? "" : n.nonce());
                payload.put("pong", true);
            }
            case ERROR -> {
                payload.put("error", n.message());
                if (n.reason() != null) {
                    payload.put("reason", n.reason().name());
                }
            }
        }
        return envelope(n.kind().name(), n.productId(), n.ts(), payload);
    }

    private ObjectNode bidToJson(Bid bid) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("sequence", bid.sequence());
        node.put("bidder", bid.bidderId());
        node.put("amount", bid.amount().toPlainString());
        node.put("timestamp", bid.acceptedAt().toString());
        return node;
    }

    private ObjectNode envelope(String type, String productId, Instant ts, ObjectNode payload) {
        ObjectNode obj = MAPPER.createObjectNode();
        obj.put("type", type);
        if (productId != null) {
            obj.put("productId", productId);
        }
        obj.set("payload", payload);
        obj.put("ts", (ts == null ? Instant.now() : ts).toString());
        return obj;
    }

    private static void putAmount(ObjectNode node, String field, BigDecimal amount) {
        if (amount == null) {
            node.putNull(field);
        } else {
            node.put(field, amount.toPlainString());
        }
    }
}

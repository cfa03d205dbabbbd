package in.livebid.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.livebid.domain.bid.BidRequest;
import in.livebid.security.InputValidator;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Parses inbound client messages.
 *
 * Accepted shapes:
 * <pre>
 * {"action": "bid", "amount": "150.00"}     (amount may also be a JSON number)
 * {"amount": 150}                           (action defaults to bid)
 * {"action": "ping", "nonce": "abc"}
 * </pre>
 */
public final class BidRequestParser {
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private final InputValidator validator;

    public BidRequestParser(InputValidator validator) {
        this.validator = validator;
    }

    public BidRequest parse(String raw) throws MalformedMessageException {
        if (raw == null || raw.isBlank()) {
            throw new MalformedMessageException("Empty message");
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new MalformedMessageException("Expected a JSON object");
        }

        String action = node.path("action").asText("bid").trim().toLowerCase(Locale.ROOT);
        return switch (action) {
            case "bid" -> BidRequest.bid(parseAmount(node.get("amount")));
            case "ping" -> BidRequest.ping(parseNonce(node.get("nonce")));
            default -> throw new MalformedMessageException("Unknown action: " + action);
        };
    }

    private BigDecimal parseAmount(JsonNode amountNode) throws MalformedMessageException {
        if (amountNode == null || amountNode.isNull()) {
            throw new MalformedMessageException("Missing 'amount'");
        }

        BigDecimal amount;
        if (amountNode.isNumber()) {
            amount = amountNode.decimalValue();
        } else if (amountNode.isTextual()) {
            try {
                amount = new BigDecimal(amountNode.asText().trim());
            } catch (NumberFormatException e) {
                throw new MalformedMessageException("Amount is not a number: " + amountNode.asText());
            }
        } else {
            throw new MalformedMessageException("Amount must be a number or numeric string");
        }

        try {
            validator.validateBidAmount(amount);
        } catch (IllegalArgumentException e) {
            throw new MalformedMessageException(e.getMessage());
        }
        return amount;
    }

    private String parseNonce(JsonNode nonceNode) throws MalformedMessageException {
        if (nonceNode == null || nonceNode.isNull()) {
            return "";
        }
        String nonce = nonceNode.asText();
        if (!validator.isSafeString(nonce)) {
            throw new MalformedMessageException("Invalid nonce");
        }
        return nonce;
    }
}

package in.livebid.security;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Input validator for client-supplied identifiers and amounts.
 *
 * Validation Rules:
 * - Product ids: alphanumeric with limited special chars (:, -, _, .), max 64 chars
 * - Bid amounts: at most 2 decimal places, max 1,000,000,000
 * - Strings: max length 1000, no script/markup patterns
 *
 * Sign and minimum checks on amounts belong to the bid sequencer, which answers them with
 * AMOUNT_TOO_LOW rather than a protocol error.
 */
public class InputValidator {

    private static final Pattern PRODUCT_ID_PATTERN = Pattern.compile("^[A-Za-z0-9_.:-]+$");

    private static final Pattern XSS_PATTERN =
        Pattern.compile(".*(<script|javascript:|onerror=|onload=|<iframe|<object|<embed).*",
            Pattern.CASE_INSENSITIVE);

    private static final int MAX_PRODUCT_ID_LENGTH = 64;
    private static final int MAX_STRING_LENGTH = 1000;
    private static final int MAX_AMOUNT_SCALE = 2;
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("1000000000");

    /**
     * Validate product identifier.
     *
     * @param productId Product identifier
     * @return true if valid
     */
    public boolean isValidProductId(String productId) {
        if (productId == null || productId.isBlank()) {
            return false;
        }
        if (productId.length() > MAX_PRODUCT_ID_LENGTH) {
            return false;
        }
        return PRODUCT_ID_PATTERN.matcher(productId).matches();
    }

    /**
     * Validate bid amount format.
     *
     * Rules:
     * - Must be present
     * - Scale <= 2 decimal places (after stripping trailing zeros)
     * - Must be <= MAX_AMOUNT
     *
     * @param amount Bid amount
     * @throws IllegalArgumentException if invalid
     */
    public void validateBidAmount(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        if (amount.stripTrailingZeros().scale() > MAX_AMOUNT_SCALE) {
            throw new IllegalArgumentException("Amount has more than " + MAX_AMOUNT_SCALE + " decimal places: " + amount);
        }
        if (amount.compareTo(MAX_AMOUNT) > 0) {
            throw new IllegalArgumentException("Amount exceeds maximum (" + MAX_AMOUNT.toPlainString() + "): " + amount);
        }
    }

    /**
     * Check a free-form client string (nonce, bidder display values).
     *
     * @param input Input string
     * @return true if safe
     */
    public boolean isSafeString(String input) {
        if (input == null) {
            return true;
        }
        if (input.length() > MAX_STRING_LENGTH) {
            return false;
        }
        return !XSS_PATTERN.matcher(input).matches();
    }
}

package in.livebid.security;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InputValidator.
 */
@DisplayName("Input Validator Tests")
public class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    public void setUp() {
        validator = new InputValidator();
    }

    @Test
    @DisplayName("Valid product ids pass validation")
    public void testValidProductIds() {
        assertTrue(validator.isValidProductId("lot-100"));
        assertTrue(validator.isValidProductId("LOT_7"));
        assertTrue(validator.isValidProductId("spring:2024.lot-3"));
        assertTrue(validator.isValidProductId("a".repeat(64)));
    }

    @Test
    @DisplayName("Invalid product ids fail validation")
    public void testInvalidProductIds() {
        assertFalse(validator.isValidProductId(null));
        assertFalse(validator.isValidProductId(""));
        assertFalse(validator.isValidProductId("   "));
        assertFalse(validator.isValidProductId("lot<script>"));
        assertFalse(validator.isValidProductId("lot 1"));
        assertFalse(validator.isValidProductId("lot/../1"));
        assertFalse(validator.isValidProductId("a".repeat(65)));
    }

    @Test
    @DisplayName("Well-formed amounts pass")
    public void testValidAmounts() {
        assertDoesNotThrow(() -> validator.validateBidAmount(new BigDecimal("100")));
        assertDoesNotThrow(() -> validator.validateBidAmount(new BigDecimal("100.50")));
        assertDoesNotThrow(() -> validator.validateBidAmount(new BigDecimal("100.500")));
        assertDoesNotThrow(() -> validator.validateBidAmount(new BigDecimal("1000000000")));
    }

    @Test
    @DisplayName("Sign is left to the sequencer")
    public void testNonPositiveAmountsAreWellFormed() {
        assertDoesNotThrow(() -> validator.validateBidAmount(BigDecimal.ZERO));
        assertDoesNotThrow(() -> validator.validateBidAmount(new BigDecimal("-5")));
    }

    @Test
    @DisplayName("Malformed amounts throw exception")
    public void testInvalidAmounts() {
        assertThrows(IllegalArgumentException.class, () -> validator.validateBidAmount(null));
        assertThrows(IllegalArgumentException.class,
            () -> validator.validateBidAmount(new BigDecimal("100.123"))); // 3 decimal places
        assertThrows(IllegalArgumentException.class,
            () -> validator.validateBidAmount(new BigDecimal("1000000000.01")));
    }

    @Test
    @DisplayName("XSS patterns detected")
    public void testXssDetection() {
        assertFalse(validator.isSafeString("<script>alert(1)</script>"));
        assertFalse(validator.isSafeString("javascript:void(0)"));
        assertFalse(validator.isSafeString("<img onerror=alert(1)>"));
        assertTrue(validator.isSafeString("nonce-42"));
        assertTrue(validator.isSafeString(null));
    }

    @Test
    @DisplayName("Overlong strings rejected")
    public void testStringLength() {
        assertTrue(validator.isSafeString("x".repeat(1000)));
        assertFalse(validator.isSafeString("x".repeat(1001)));
    }
}

package in.livebid.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Base64;

/**
 * HS256 bidder tokens.
 *
 * The connection query carries {@code ?token=...}; a valid token yields the bidder id (the
 * {@code sub} claim), anything else yields null and the connection is watch-only.
 */
public final class JwtService {
    private static final Logger log = LoggerFactory.getLogger(JwtService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String HEADER = base64Encode("{\"alg\":\"HS256\",\"typ\":\"JWT\"}");

    private final byte[] secret;
    private final long expirationMs;
    private final Clock clock;

    public JwtService(String secret, long expirationMs) {
        this(secret, expirationMs, Clock.systemUTC());
    }

    public JwtService(String secret, long expirationMs, Clock clock) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("JWT secret must not be empty");
        }
        this.secret = secret.getBytes(StandardCharsets.UTF_8);
        this.expirationMs = expirationMs;
        this.clock = clock;
    }

    /**
     * Generate a token for a bidder.
     */
    public String generateToken(String bidderId) {
        long now = clock.millis();
        ObjectNode claims = MAPPER.createObjectNode();
        claims.put("sub", bidderId);
        claims.put("iat", now / 1000);
        claims.put("exp", (now + expirationMs) / 1000);

        String payload;
        try {
            payload = base64Encode(MAPPER.writeValueAsString(claims));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode JWT claims", e);
        }
        return HEADER + "." + payload + "." + sign(HEADER + "." + payload);
    }

    /**
     * Validate token and extract the bidder id.
     * Returns null if invalid.
     */
    public String validateAndGetBidderId(String token) {
        if (token == null || token.isEmpty()) {
            return null;
        }
        if (token.startsWith("Bearer ")) {
            token = token.substring(7);
        }

        String[] parts = token.split("\\.");
        if (parts.length != 3) {
            log.debug("Invalid token format");
            return null;
        }

        byte[] expected = sign(parts[0] + "." + parts[1]).getBytes(StandardCharsets.US_ASCII);
        if (!MessageDigest.isEqual(expected, parts[2].getBytes(StandardCharsets.US_ASCII))) {
            log.debug("Invalid token signature");
            return null;
        }

        JsonNode claims;
        try {
            claims = MAPPER.readTree(Base64.getUrlDecoder().decode(parts[1]));
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Token payload unreadable: {}", e.getMessage());
            return null;
        }

        String sub = claims.path("sub").asText(null);
        if (sub == null || sub.isEmpty() || !claims.path("exp").canConvertToLong()) {
            log.debug("Missing required claims");
            return null;
        }
        if (clock.millis() > claims.path("exp").asLong() * 1000) {
            log.debug("Token expired");
            return null;
        }
        return sub;
    }

    private String sign(String data) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret, "HmacSHA256"));
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hash);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String base64Encode(String data) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString(data.getBytes(StandardCharsets.UTF_8));
    }
}

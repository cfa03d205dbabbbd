package in.livebid.bootstrap;

import in.livebid.config.RoomSettings;
import in.livebid.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Startup configuration validator.
 *
 * Runs before any room infrastructure is created. Throws IllegalStateException if the
 * configuration is invalid; in production mode misconfigurations that only warn in
 * development become hard failures.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    static final String DEFAULT_JWT_SECRET = "livebid-secret-key-change-in-production";
    private static final int MIN_SECRET_LENGTH = 32;
    private static final Duration MAX_SUBMIT_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Validate configuration at startup.
     *
     * @param settings     Room tuning
     * @param jwtSecret    Bidder token secret
     * @param auctionsFile Catalog file, or null for the built-in demo catalog
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(RoomSettings settings, String jwtSecret, String auctionsFile) {
        validate(settings, jwtSecret, auctionsFile, Env.getBool("PRODUCTION_MODE", false));
    }

    static void validate(RoomSettings settings, String jwtSecret, String auctionsFile, boolean productionMode) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");
        log.info("Production mode: {}", productionMode);

        if (settings.submitTimeout().compareTo(MAX_SUBMIT_TIMEOUT) > 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: BID_SUBMIT_TIMEOUT_MS=" + settings.submitTimeout().toMillis() +
                " exceeds " + MAX_SUBMIT_TIMEOUT.toMillis() + "ms\n" +
                "Bidders would wait that long for a ROOM_UNAVAILABLE answer."
            );
        }
        if (settings.subscriberQueueCapacity() < 2) {
            throw new IllegalStateException(
                "INVALID CONFIG: SUBSCRIBER_QUEUE_CAPACITY must be at least 2 " +
                "(snapshot plus one event), got " + settings.subscriberQueueCapacity()
            );
        }

        if (auctionsFile != null && !Files.isReadable(Path.of(auctionsFile))) {
            throw new IllegalStateException("INVALID CONFIG: AUCTIONS_FILE is not readable: " + auctionsFile);
        }

        if (productionMode) {
            validateProductionMode(jwtSecret, auctionsFile);
        } else {
            warnNonProductionMode(jwtSecret, auctionsFile);
        }

        log.info("Rooms: mailbox={}, subscriberQueue={}, submitTimeout={}ms, recentBids={}",
            settings.mailboxCapacity(), settings.subscriberQueueCapacity(),
            settings.submitTimeout().toMillis(), settings.recentBids());
        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void validateProductionMode(String jwtSecret, String auctionsFile) {
        log.info("PRODUCTION MODE detected - enforcing strict validation");

        if (jwtSecret == null || DEFAULT_JWT_SECRET.equals(jwtSecret) || jwtSecret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires a JWT_SECRET of at least " +
                MIN_SECRET_LENGTH + " characters that is not the development default\n" +
                "System refuses to start."
            );
        }
        log.info("✓ JWT secret configured");

        if (auctionsFile == null) {
            throw new IllegalStateException(
                "INVALID CONFIG: PRODUCTION MODE requires AUCTIONS_FILE\n" +
                "The built-in demo catalog is for development only."
            );
        }
        log.info("✓ Auction catalog: {}", auctionsFile);
    }

    private static void warnNonProductionMode(String jwtSecret, String auctionsFile) {
        if (jwtSecret == null || DEFAULT_JWT_SECRET.equals(jwtSecret)) {
            log.warn("⚠️  Using development JWT secret");
        }
        if (auctionsFile == null) {
            log.warn("⚠️  AUCTIONS_FILE not set, using demo catalog");
        }
    }

    private StartupConfigValidator() {}
}

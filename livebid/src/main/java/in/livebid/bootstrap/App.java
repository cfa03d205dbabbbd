package in.livebid.bootstrap;

import in.livebid.application.port.input.AuctionSessionService;
import in.livebid.application.service.AsyncBidRecorder;
import in.livebid.application.service.AuctionSessionServiceImpl;
import in.livebid.auth.JwtService;
import in.livebid.config.RoomSettings;
import in.livebid.domain.auction.Auction;
import in.livebid.infrastructure.catalog.InMemoryAuctionCatalog;
import in.livebid.infrastructure.metrics.PrometheusAuctionMetrics;
import in.livebid.infrastructure.metrics.PrometheusMetricsHandler;
import in.livebid.infrastructure.persistence.InMemoryBidRecorder;
import in.livebid.room.RoomContext;
import in.livebid.room.RoomRegistry;
import in.livebid.security.InputValidator;
import in.livebid.transport.http.AuctionHttpHandlers;
import in.livebid.transport.ws.AuctionWsHub;
import in.livebid.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.Function;

/**
 * Core Java entry point (NO Spring).
 *
 * Wires the auction catalog, the room registry, the session service and the Undertow
 * WebSocket hub.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== LiveBid Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9090);
        String jwtSecret = Env.get("JWT_SECRET", StartupConfigValidator.DEFAULT_JWT_SECRET);
        long jwtExpirationMs = Env.getInt("JWT_EXPIRATION_HOURS", 24) * 3600000L;
        String auctionsFile = Env.get("AUCTIONS_FILE", null);
        String adminToken = Env.get("ADMIN_TOKEN", null);
        RoomSettings settings = RoomSettings.fromEnv();

        StartupConfigValidator.validate(settings, jwtSecret, auctionsFile);

        // ═══════════════════════════════════════════════════════════════
        // Prometheus Metrics
        // ═══════════════════════════════════════════════════════════════
        PrometheusAuctionMetrics metrics = new PrometheusAuctionMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Collaborators
        // ═══════════════════════════════════════════════════════════════
        InMemoryAuctionCatalog catalog = createCatalog(auctionsFile);
        AsyncBidRecorder recorder = new AsyncBidRecorder(new InMemoryBidRecorder(), settings.recorderThreads(), metrics);
        log.info("✓ Catalog ready ({} auctions), bid recorder on {} threads", catalog.size(), settings.recorderThreads());

        // ═══════════════════════════════════════════════════════════════
        // Rooms
        // ═══════════════════════════════════════════════════════════════
        RoomContext context = RoomContext.create(settings, Clock.systemUTC(), recorder, metrics);
        RoomRegistry registry = new RoomRegistry(catalog, context);
        InputValidator validator = new InputValidator();
        AuctionSessionService sessionService = new AuctionSessionServiceImpl(registry, validator);

        // ═══════════════════════════════════════════════════════════════
        // JWT + WebSocket hub
        // ═══════════════════════════════════════════════════════════════
        JwtService jwtService = new JwtService(jwtSecret, jwtExpirationMs);
        Function<String, String> tokenValidator = jwtService::validateAndGetBidderId;
        AuctionWsHub wsHub = new AuctionWsHub(sessionService, tokenValidator);

        AuctionHttpHandlers http = new AuctionHttpHandlers(sessionService, registry, wsHub, validator, adminToken);
        if (adminToken == null) {
            log.info("ADMIN_TOKEN not set, admin endpoints disabled");
        }

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()))
            .get("/health", http::health)
            .post("/api/admin/auctions/{productId}/close", http::closeAuction)
            .get("/ws/auction", wsHub.websocketHandler())
            .setFallbackHandler(exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "LiveBid\n\n" +
                    "API:  GET /health, /metrics\n" +
                    "WS:   ws://localhost:" + port + "/ws/auction?productId=<id>&token=<jwt>\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            wsHub.closeAll();
            registry.shutdown();
            recorder.shutdown();
            server.stop();
            log.info("LiveBid stopped");
        }, "shutdown-hook"));

        server.start();
        log.info("✓ LiveBid started on http://localhost:{}/", port);
    }

    private static InMemoryAuctionCatalog createCatalog(String auctionsFile) {
        InMemoryAuctionCatalog catalog = new InMemoryAuctionCatalog();
        if (auctionsFile != null) {
            try {
                catalog.loadFromJson(Path.of(auctionsFile));
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load auctions from " + auctionsFile + ": " + e.getMessage(), e);
            }
            return catalog;
        }

        Instant now = Instant.now();
        catalog.register(new Auction("demo-lot-1", new BigDecimal("100.00"), now, now.plus(Duration.ofHours(1))));
        catalog.register(new Auction("demo-lot-2", new BigDecimal("250.00"),
            now.plus(Duration.ofMinutes(5)), now.plus(Duration.ofMinutes(35))));
        log.info("Registered demo auctions: demo-lot-1 (open), demo-lot-2 (opens in 5 minutes)");
        return catalog;
    }
}

package in.pairguard.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import in.pairguard.application.health.HealthCheckScheduler;
import in.pairguard.application.health.OperatorNotifier;
import in.pairguard.application.health.RecoveryOrchestrator;
import in.pairguard.application.health.SupervisorEvents;
import in.pairguard.application.health.SupervisorStateRepository;
import in.pairguard.application.port.output.KeyValueStore;
import in.pairguard.application.port.output.NotificationChannel;
import in.pairguard.application.port.output.WatchedConnection;
import in.pairguard.config.SupervisorConfig;
import in.pairguard.infrastructure.connection.HttpWatchedConnection;
import in.pairguard.infrastructure.metrics.PrometheusMetricsHandler;
import in.pairguard.infrastructure.metrics.PrometheusSupervisorMetrics;
import in.pairguard.infrastructure.persistence.InMemoryKeyValueStore;
import in.pairguard.infrastructure.persistence.PostgresKeyValueStore;
import in.pairguard.infrastructure.slack.SlackNotificationChannel;
import in.pairguard.migration.HealthMonitorStateMigration;
import in.pairguard.transport.http.HealthMonitorHandler;
import in.pairguard.util.Env;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Entry point: wires the health supervisor to the bot, Slack, PostgreSQL and the admin API.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== PairGuard Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        int port = Env.getInt("PORT", 9091);

        // ═══════════════════════════════════════════════════════════════
        // Configuration gate
        // ═══════════════════════════════════════════════════════════════
        SupervisorConfig config = SupervisorConfig.fromEnv();
        try {
            config.validate();
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
        }
        if (config.notifyTarget().isEmpty()) {
            log.warn("HEALTH_MONITOR_NOTIFY_TARGET not set - pairing codes will only be logged");
        }

        // ═══════════════════════════════════════════════════════════════
        // State store
        // ═══════════════════════════════════════════════════════════════
        KeyValueStore stateStore = createStateStore();

        // ═══════════════════════════════════════════════════════════════
        // Collaborators
        // ═══════════════════════════════════════════════════════════════
        String botUrl = Env.get("WHATSAPP_BOT_URL", "http://localhost:4097");
        WatchedConnection connection = new HttpWatchedConnection(botUrl);
        log.info("✓ Watching bot connection at {}", botUrl);

        NotificationChannel slack = createSlackChannel();

        // ═══════════════════════════════════════════════════════════════
        // Health supervisor
        // ═══════════════════════════════════════════════════════════════
        Clock clock = Clock.systemUTC();
        SupervisorEvents events = new SupervisorEvents();
        SupervisorStateRepository stateRepository = new SupervisorStateRepository(stateStore);
        OperatorNotifier notifier = new OperatorNotifier(slack, events);
        RecoveryOrchestrator orchestrator =
            new RecoveryOrchestrator(connection, notifier, stateRepository, events, config, clock);
        HealthCheckScheduler supervisor =
            new HealthCheckScheduler(config, connection, stateRepository, orchestrator, events, clock);

        PrometheusSupervisorMetrics metrics = new PrometheusSupervisorMetrics();
        supervisor.addListener(metrics);
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // HTTP API
        // ═══════════════════════════════════════════════════════════════
        HealthMonitorHandler healthHandler = new HealthMonitorHandler(supervisor);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = Handlers.routing()
            .get("/metrics", metricsHandler)
            .get("/api/health", healthHandler::health)
            .get("/api/health-monitor/status", healthHandler::getStatus)
            .post("/api/health-monitor/check", healthHandler::forceCheck)
            .post("/api/health-monitor/pairing", healthHandler::forcePairing)
            .post("/api/health-monitor/reset", healthHandler::reset)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "PairGuard\n\n" +
                    "API:  GET /api/health, /api/health-monitor/status\n" +
                    "      POST /api/health-monitor/check, /api/health-monitor/pairing, /api/health-monitor/reset\n" +
                    "Metrics: GET /metrics\n"
                );
            });

        Undertow server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(routes)
            .build();
        server.start();
        log.info("✓ HTTP API server started on port {}", port);

        supervisor.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down PairGuard");
            supervisor.close();
            server.stop();
        }, "PairGuard-shutdown"));
    }

    private static KeyValueStore createStateStore() {
        String url = Env.get("DB_URL", null);
        if (url == null) {
            log.warn("DB_URL not set - health monitor state will not survive restarts");
            return new InMemoryKeyValueStore();
        }

        String user = Env.get("DB_USER", "postgres");
        String pass = Env.get("DB_PASS", "postgres");
        int maxPool = Env.getInt("DB_POOL_SIZE", 4);

        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername(user);
        config.setPassword(pass);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);
        config.setPoolName("pairguard-hikari");

        log.info("DB: url={}, user={}, pool={}", url, user, maxPool);
        HikariDataSource dataSource = new HikariDataSource(config);

        new HealthMonitorStateMigration(dataSource).migrate();
        return new PostgresKeyValueStore(dataSource);
    }

    private static NotificationChannel createSlackChannel() {
        String token = Env.get("SLACK_BOT_TOKEN", null);
        if (token == null) {
            log.warn("SLACK_BOT_TOKEN not set - operator notifications disabled");
            return null;
        }
        String apiUrl = Env.get("SLACK_API_URL", SlackNotificationChannel.DEFAULT_API_URL);
        log.info("✓ Slack notifications enabled ({})", apiUrl);
        return new SlackNotificationChannel(apiUrl, token);
    }

    private App() {}
}

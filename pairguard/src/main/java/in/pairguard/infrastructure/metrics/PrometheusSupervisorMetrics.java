package in.pairguard.infrastructure.metrics;

import in.pairguard.application.health.SupervisorListener;
import in.pairguard.domain.health.HealthStatus;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.SkipReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prometheus view of the health supervisor's signals.
 *
 * Key Metrics:
 * - health_monitor_checks_total{result} - Completed checks by outcome
 * - health_monitor_connection_healthy - Last liveness read (1=ready, 0=down)
 * - health_monitor_consecutive_failures - Current unhealthy streak
 * - health_monitor_pairing_state{state} - 1 for the current pairing state
 * - health_monitor_pairing_requests_total - Pairing codes issued
 * - health_monitor_pairing_skipped_total{reason} - Checks skipped while pairing/cooling down
 * - health_monitor_notifications_sent_total - Operator notifications delivered
 * - health_monitor_errors_total{type} - Recovery, notification and check failures
 *
 * Usage:
 * <pre>
 * PrometheusSupervisorMetrics metrics = new PrometheusSupervisorMetrics();
 * supervisor.addListener(metrics);
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusSupervisorMetrics implements SupervisorListener {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSupervisorMetrics.class);

    private final CollectorRegistry registry;

    // Check metrics
    private final Counter checkCounter;
    private final Gauge connectionHealthy;
    private final Gauge consecutiveFailures;

    // Pairing metrics
    private final Gauge pairingState;
    private final Counter pairingRequestCounter;
    private final Counter pairingSkippedCounter;
    private final Counter notificationCounter;

    // Error metrics
    private final Counter errorCounter;

    public PrometheusSupervisorMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSupervisorMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.checkCounter = Counter.build()
            .name("health_monitor_checks_total")
            .help("Total number of completed health checks")
            .labelNames("result")
            .register(registry);

        this.connectionHealthy = Gauge.build()
            .name("health_monitor_connection_healthy")
            .help("Last liveness read of the watched connection (1=ready, 0=down)")
            .register(registry);

        this.consecutiveFailures = Gauge.build()
            .name("health_monitor_consecutive_failures")
            .help("Consecutive unhealthy checks counted toward recovery")
            .register(registry);

        this.pairingState = Gauge.build()
            .name("health_monitor_pairing_state")
            .help("Current pairing state (1 for the active state)")
            .labelNames("state")
            .register(registry);

        this.pairingRequestCounter = Counter.build()
            .name("health_monitor_pairing_requests_total")
            .help("Total number of pairing codes issued")
            .register(registry);

        this.pairingSkippedCounter = Counter.build()
            .name("health_monitor_pairing_skipped_total")
            .help("Total number of unhealthy checks skipped")
            .labelNames("reason")
            .register(registry);

        this.notificationCounter = Counter.build()
            .name("health_monitor_notifications_sent_total")
            .help("Total number of operator notifications delivered")
            .register(registry);

        this.errorCounter = Counter.build()
            .name("health_monitor_errors_total")
            .help("Total number of supervisor errors")
            .labelNames("type")
            .register(registry);

        for (PairingState state : PairingState.values()) {
            pairingState.labels(state.code()).set(state == PairingState.IDLE ? 1 : 0);
        }

        log.info("Prometheus supervisor metrics initialized");
    }

    @Override
    public void onHealthCheck(HealthStatus status) {
        checkCounter.labels(status.healthy() ? "healthy" : "unhealthy").inc();
        connectionHealthy.set(status.healthy() ? 1 : 0);
        consecutiveFailures.set(status.consecutiveFailures());
        for (PairingState state : PairingState.values()) {
            pairingState.labels(state.code()).set(state == status.pairingState() ? 1 : 0);
        }
    }

    @Override
    public void onPairingRequested(String code) {
        pairingRequestCounter.inc();
    }

    @Override
    public void onPairingSkipped(SkipReason reason) {
        pairingSkippedCounter.labels(reason.code()).inc();
    }

    @Override
    public void onPairingNotificationSent(String target) {
        notificationCounter.inc();
    }

    @Override
    public void onError(Throwable error) {
        errorCounter.labels(error.getClass().getSimpleName()).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}

package in.pairguard.infrastructure.metrics;

import in.pairguard.application.health.RecoveryException;
import in.pairguard.application.health.RecoveryStep;
import in.pairguard.domain.health.HealthStatus;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.SkipReason;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusSupervisorMetricsTest {

    private CollectorRegistry registry;
    private PrometheusSupervisorMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusSupervisorMetrics(registry);
    }

    private double sample(String name, String[] labels, String[] values) {
        Double value = registry.getSampleValue(name, labels, values);
        return value == null ? 0.0 : value;
    }

    private double stateGauge(PairingState state) {
        return sample("health_monitor_pairing_state", new String[]{"state"}, new String[]{state.code()});
    }

    @Test
    void testStartsIdle() {
        assertEquals(1.0, stateGauge(PairingState.IDLE));
        assertEquals(0.0, stateGauge(PairingState.COOLDOWN));
    }

    @Test
    void testHealthCheckUpdatesGauges() {
        Instant now = Instant.parse("2026-03-01T12:00:00Z");
        metrics.onHealthCheck(new HealthStatus(false, 2, now, null, PairingState.PAIRING_REQUESTED, now, 0));

        assertEquals(1.0, sample("health_monitor_checks_total", new String[]{"result"}, new String[]{"unhealthy"}));
        assertEquals(0.0, registry.getSampleValue("health_monitor_connection_healthy"));
        assertEquals(2.0, registry.getSampleValue("health_monitor_consecutive_failures"));
        assertEquals(1.0, stateGauge(PairingState.PAIRING_REQUESTED));
        assertEquals(0.0, stateGauge(PairingState.IDLE));
    }

    @Test
    void testCountersFollowSignals() {
        metrics.onPairingRequested("ABCD-1234");
        metrics.onPairingNotificationSent("U0OPS");
        metrics.onPairingSkipped(SkipReason.WAITING_FOR_USER);
        metrics.onPairingSkipped(SkipReason.WAITING_FOR_USER);
        metrics.onError(new RecoveryException(RecoveryStep.DISCONNECT, "boom"));

        assertEquals(1.0, registry.getSampleValue("health_monitor_pairing_requests_total"));
        assertEquals(1.0, registry.getSampleValue("health_monitor_notifications_sent_total"));
        assertEquals(2.0, sample("health_monitor_pairing_skipped_total",
            new String[]{"reason"}, new String[]{"waiting_for_user"}));
        assertEquals(1.0, sample("health_monitor_errors_total",
            new String[]{"type"}, new String[]{"RecoveryException"}));
    }
}

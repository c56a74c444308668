package in.pairguard.application.health;

import in.pairguard.domain.health.HealthStatus;
import in.pairguard.domain.health.SkipReason;

/**
 * Observer for signals emitted by the health supervisor.
 *
 * All methods default to no-ops so listeners override only what they need.
 * Callbacks run on the supervisor's thread and must not block.
 */
public interface SupervisorListener {

    /**
     * A health check completed.
     */
    default void onHealthCheck(HealthStatus status) {}

    /**
     * The watched connection reported itself ready.
     */
    default void onHealthy() {}

    /**
     * An unhealthy check was counted toward the failure threshold.
     */
    default void onUnhealthy(int consecutiveFailures) {}

    /**
     * A new pairing code was issued.
     *
     * @param code formatted code as sent to the operator
     */
    default void onPairingRequested(String code) {}

    /**
     * The operator was notified of a new pairing code.
     */
    default void onPairingNotificationSent(String target) {}

    /**
     * An unhealthy check was not counted because recovery is pending or cooling down.
     */
    default void onPairingSkipped(SkipReason reason) {}

    /**
     * A recovery step, a notification or a check itself failed.
     */
    default void onError(Throwable error) {}
}

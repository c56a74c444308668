package in.pairguard.config;

import in.pairguard.util.Env;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Configuration for the connection health supervisor.
 *
 * Immutable; supplied once at construction of the scheduler.
 */
public record SupervisorConfig(
    boolean enabled,
    Duration checkInterval,         // time between health checks
    int failureThreshold,           // consecutive unhealthy checks before recovery
    Duration cooldown,              // minimum spacing between recovery attempts
    Duration maxPairingWait,        // how long to wait for the operator to pair
    String notifyTarget,            // operator channel address (Slack user id)
    String recoveryIdentity,        // phone number the pairing code is requested for
    Duration initialDelay           // grace before the first check after start()
) {
    public static final Duration DEFAULT_CHECK_INTERVAL = Duration.ofMinutes(5);
    public static final int DEFAULT_FAILURE_THRESHOLD = 2;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofHours(4);
    public static final Duration DEFAULT_MAX_PAIRING_WAIT = Duration.ofHours(8);
    public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(10);

    public SupervisorConfig {
        Objects.requireNonNull(checkInterval, "checkInterval");
        Objects.requireNonNull(cooldown, "cooldown");
        Objects.requireNonNull(maxPairingWait, "maxPairingWait");
        Objects.requireNonNull(initialDelay, "initialDelay");
        notifyTarget = notifyTarget == null ? "" : notifyTarget.trim();
        recoveryIdentity = recoveryIdentity == null ? "" : recoveryIdentity.trim();
    }

    /**
     * Defaults for everything except the two identifiers.
     */
    public static SupervisorConfig defaults(String notifyTarget, String recoveryIdentity) {
        return new SupervisorConfig(
            true,
            DEFAULT_CHECK_INTERVAL,
            DEFAULT_FAILURE_THRESHOLD,
            DEFAULT_COOLDOWN,
            DEFAULT_MAX_PAIRING_WAIT,
            notifyTarget,
            recoveryIdentity,
            DEFAULT_INITIAL_DELAY
        );
    }

    /**
     * Load from environment variables (falling back to system properties).
     */
    public static SupervisorConfig fromEnv() {
        return new SupervisorConfig(
            Env.getBool("HEALTH_MONITOR_ENABLED", false),
            Env.getMillis("HEALTH_MONITOR_INTERVAL_MS", DEFAULT_CHECK_INTERVAL),
            Env.getInt("HEALTH_MONITOR_FAILURE_THRESHOLD", DEFAULT_FAILURE_THRESHOLD),
            Env.getMillis("HEALTH_MONITOR_COOLDOWN_MS", DEFAULT_COOLDOWN),
            Env.getMillis("HEALTH_MONITOR_MAX_PAIRING_WAIT_MS", DEFAULT_MAX_PAIRING_WAIT),
            Env.get("HEALTH_MONITOR_NOTIFY_TARGET", ""),
            Env.get("WHATSAPP_ADMIN_PHONE", ""),
            Env.getMillis("HEALTH_MONITOR_INITIAL_DELAY_MS", DEFAULT_INITIAL_DELAY)
        );
    }

    public SupervisorConfig withEnabled(boolean value) {
        return new SupervisorConfig(value, checkInterval, failureThreshold, cooldown,
            maxPairingWait, notifyTarget, recoveryIdentity, initialDelay);
    }

    public SupervisorConfig withCheckInterval(Duration value) {
        return new SupervisorConfig(enabled, value, failureThreshold, cooldown,
            maxPairingWait, notifyTarget, recoveryIdentity, initialDelay);
    }

    public SupervisorConfig withFailureThreshold(int value) {
        return new SupervisorConfig(enabled, checkInterval, value, cooldown,
            maxPairingWait, notifyTarget, recoveryIdentity, initialDelay);
    }

    public SupervisorConfig withCooldown(Duration value) {
        return new SupervisorConfig(enabled, checkInterval, failureThreshold, value,
            maxPairingWait, notifyTarget, recoveryIdentity, initialDelay);
    }

    public SupervisorConfig withMaxPairingWait(Duration value) {
        return new SupervisorConfig(enabled, checkInterval, failureThreshold, cooldown,
            value, notifyTarget, recoveryIdentity, initialDelay);
    }

    public SupervisorConfig withInitialDelay(Duration value) {
        return new SupervisorConfig(enabled, checkInterval, failureThreshold, cooldown,
            maxPairingWait, notifyTarget, recoveryIdentity, value);
    }

    /**
     * Collect configuration problems. Empty list means valid.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            problems.add("checkInterval must be positive (got " + checkInterval.toMillis() + "ms)");
        }
        if (failureThreshold < 1) {
            problems.add("failureThreshold must be >= 1 (got " + failureThreshold + ")");
        }
        if (cooldown.isNegative()) {
            problems.add("cooldown must not be negative (got " + cooldown.toMillis() + "ms)");
        }
        if (maxPairingWait.isZero() || maxPairingWait.isNegative()) {
            problems.add("maxPairingWait must be positive (got " + maxPairingWait.toMillis() + "ms)");
        }
        if (initialDelay.isNegative()) {
            problems.add("initialDelay must not be negative (got " + initialDelay.toMillis() + "ms)");
        }
        if (enabled) {
            int digits = recoveryIdentity.replaceAll("\\D", "").length();
            if (digits < 10 || digits > 15) {
                problems.add("recoveryIdentity must contain 10-15 digits in international format");
            }
        }
        return problems;
    }

    /**
     * @throws IllegalStateException listing every violation
     */
    public void validate() {
        List<String> problems = violations();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid health monitor configuration:\n  - "
                + String.join("\n  - ", problems));
        }
    }
}

package in.pairguard.domain.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read-only view of the supervisor, as returned to callers and the admin API.
 */
public record HealthStatus(
    @JsonProperty("isHealthy")
    boolean healthy,

    @JsonProperty("consecutiveFailures")
    int consecutiveFailures,

    @JsonProperty("lastCheckTime")
    Instant lastCheckTime,

    @JsonProperty("lastHealthyTime")
    Instant lastHealthyTime,

    @JsonProperty("pairingState")
    PairingState pairingState,

    @JsonProperty("lastPairingRequestTime")
    Instant lastPairingRequestTime,

    @JsonProperty("cooldownRemainingMs")
    long cooldownRemainingMs      // 0 unless in cooldown
) {
}

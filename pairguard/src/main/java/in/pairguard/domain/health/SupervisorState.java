package in.pairguard.domain.health;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of the supervisor's bookkeeping.
 *
 * pairingState, consecutiveFailures and lastPairingRequestTime survive restarts;
 * lastCheckTime and lastHealthyTime are runtime only. Nullable timestamps mean "never".
 */
public record SupervisorState(
        PairingState pairingState,
        int consecutiveFailures,
        Instant lastPairingRequestTime,
        Instant lastCheckTime,
        Instant lastHealthyTime) {

    public SupervisorState {
        Objects.requireNonNull(pairingState, "pairingState");
        if (consecutiveFailures < 0) {
            throw new IllegalArgumentException("consecutiveFailures must be >= 0: " + consecutiveFailures);
        }
    }

    /**
     * State of a supervisor that has never run.
     */
    public static SupervisorState initial() {
        return new SupervisorState(PairingState.IDLE, 0, null, null, null);
    }

    public SupervisorState withPairingState(PairingState state) {
        return new SupervisorState(state, consecutiveFailures, lastPairingRequestTime, lastCheckTime, lastHealthyTime);
    }

    public SupervisorState withConsecutiveFailures(int failures) {
        return new SupervisorState(pairingState, failures, lastPairingRequestTime, lastCheckTime, lastHealthyTime);
    }

    public SupervisorState withLastPairingRequestTime(Instant time) {
        return new SupervisorState(pairingState, consecutiveFailures, time, lastCheckTime, lastHealthyTime);
    }

    public SupervisorState withLastCheckTime(Instant time) {
        return new SupervisorState(pairingState, consecutiveFailures, lastPairingRequestTime, time, lastHealthyTime);
    }

    public SupervisorState withLastHealthyTime(Instant time) {
        return new SupervisorState(pairingState, consecutiveFailures, lastPairingRequestTime, lastCheckTime, time);
    }

    /**
     * Enter pairing_requested or cooldown, stamping the request time.
     */
    public SupervisorState enter(PairingState state, Instant now) {
        return new SupervisorState(state, consecutiveFailures, now, lastCheckTime, lastHealthyTime);
    }

    /**
     * Same persisted fields, ignoring runtime-only timestamps.
     */
    public boolean samePersistentState(SupervisorState other) {
        return other != null
            && pairingState == other.pairingState
            && consecutiveFailures == other.consecutiveFailures
            && Objects.equals(lastPairingRequestTime, other.lastPairingRequestTime);
    }
}

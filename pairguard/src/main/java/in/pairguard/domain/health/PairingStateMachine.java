package in.pairguard.domain.health;

import in.pairguard.config.SupervisorConfig;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure decision logic of the health supervisor.
 *
 * Given the current snapshot, a liveness read and the clock, computes the next
 * snapshot and the action the scheduler has to take. Never performs I/O.
 *
 * Transitions:
 * <pre>
 * any               --live-------------------------------&gt; IDLE (failures reset)
 * IDLE              --down, failures+1 &lt; threshold-------&gt; IDLE (failures+1)
 * IDLE              --down, failures+1 &gt;= threshold, last
 *                     request older than cooldown---------&gt; PAIRING_REQUESTED + TRIGGER_RECOVERY
 * IDLE              --down, failures+1 &gt;= threshold, last
 *                     request within cooldown-------------&gt; IDLE + SKIP(cooldown)
 * PAIRING_REQUESTED --down, waited &gt; maxPairingWait------&gt; IDLE
 * PAIRING_REQUESTED --down-------------------------------&gt; PAIRING_REQUESTED + SKIP(waiting_for_user)
 * COOLDOWN          --down, waited &gt; cooldown------------&gt; IDLE
 * COOLDOWN          --down-------------------------------&gt; COOLDOWN + SKIP(cooldown)
 * </pre>
 */
public final class PairingStateMachine {

    private PairingStateMachine() {}

    /**
     * Decide the next state for one health check.
     *
     * @param state  settled state before this check
     * @param isLive liveness read of the watched connection
     * @param now    time of the check
     * @param config supervisor timing policy
     * @return next state and follow-up action
     */
    public static PairingDecision decide(SupervisorState state, boolean isLive, Instant now, SupervisorConfig config) {
        SupervisorState checked = state.withLastCheckTime(now);

        // Liveness wins over any pending bookkeeping
        if (isLive) {
            return PairingDecision.none(checked
                .withPairingState(PairingState.IDLE)
                .withConsecutiveFailures(0)
                .withLastHealthyTime(now));
        }

        switch (state.pairingState()) {
            case PAIRING_REQUESTED:
                if (hasElapsed(state.lastPairingRequestTime(), now, config.maxPairingWait())) {
                    return PairingDecision.none(checked.withPairingState(PairingState.IDLE));
                }
                return PairingDecision.skip(checked, SkipReason.WAITING_FOR_USER);

            case COOLDOWN:
                if (hasElapsed(state.lastPairingRequestTime(), now, config.cooldown())) {
                    return PairingDecision.none(checked.withPairingState(PairingState.IDLE));
                }
                return PairingDecision.skip(checked, SkipReason.COOLDOWN);

            case IDLE:
            default:
                int failures = state.consecutiveFailures() + 1;
                SupervisorState counted = checked.withConsecutiveFailures(failures);
                if (failures >= config.failureThreshold()) {
                    // Attempts are spaced by the cooldown even after a successful pairing
                    if (!hasElapsed(state.lastPairingRequestTime(), now, config.cooldown())) {
                        return PairingDecision.skip(counted, SkipReason.COOLDOWN);
                    }
                    return PairingDecision.triggerRecovery(counted.enter(PairingState.PAIRING_REQUESTED, now));
                }
                return PairingDecision.none(counted);
        }
    }

    /**
     * Time left in the cooldown window, zero outside of COOLDOWN.
     */
    public static Duration cooldownRemaining(SupervisorState state, Instant now, SupervisorConfig config) {
        if (state.pairingState() != PairingState.COOLDOWN || state.lastPairingRequestTime() == null) {
            return Duration.ZERO;
        }
        Duration remaining = config.cooldown().minus(Duration.between(state.lastPairingRequestTime(), now));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    /**
     * Strictly longer than {@code window} since {@code since}. A missing timestamp counts
     * as elapsed so a state loaded without one cannot block recovery forever.
     */
    private static boolean hasElapsed(Instant since, Instant now, Duration window) {
        if (since == null) {
            return true;
        }
        return Duration.between(since, now).compareTo(window) > 0;
    }
}

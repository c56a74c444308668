package in.pairguard.domain.health;

import java.util.Objects;

/**
 * Outcome of one {@link PairingStateMachine#decide} call.
 *
 * @param nextState  state to persist and adopt
 * @param action     follow-up the scheduler must perform
 * @param skipReason set only when {@code action == SKIP}
 */
public record PairingDecision(SupervisorState nextState, PairingAction action, SkipReason skipReason) {

    public PairingDecision {
        Objects.requireNonNull(nextState, "nextState");
        Objects.requireNonNull(action, "action");
        if ((action == PairingAction.SKIP) != (skipReason != null)) {
            throw new IllegalArgumentException("skipReason must be set exactly when action is SKIP");
        }
    }

    public static PairingDecision none(SupervisorState nextState) {
        return new PairingDecision(nextState, PairingAction.NONE, null);
    }

    public static PairingDecision triggerRecovery(SupervisorState nextState) {
        return new PairingDecision(nextState, PairingAction.TRIGGER_RECOVERY, null);
    }

    public static PairingDecision skip(SupervisorState nextState, SkipReason reason) {
        return new PairingDecision(nextState, PairingAction.SKIP, reason);
    }
}

package in.pairguard.application.health;

import in.pairguard.domain.health.SupervisorState;

/**
 * Outcome of one recovery attempt.
 *
 * @param state         state after the attempt (pairing_requested or cooldown)
 * @param pairingCode   formatted code, null on failure
 * @param operatorNotified whether the operator notification went out
 * @param error         failure cause, null on success
 */
public record RecoveryResult(SupervisorState state, String pairingCode, boolean operatorNotified, RecoveryException error) {

    public static RecoveryResult succeeded(SupervisorState state, String pairingCode, boolean operatorNotified) {
        return new RecoveryResult(state, pairingCode, operatorNotified, null);
    }

    public static RecoveryResult failed(SupervisorState state, RecoveryException error) {
        return new RecoveryResult(state, null, false, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}

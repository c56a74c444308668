package in.pairguard.domain.health;

/**
 * What the scheduler must do after a state machine decision.
 */
public enum PairingAction {
    NONE,
    TRIGGER_RECOVERY,
    SKIP
}

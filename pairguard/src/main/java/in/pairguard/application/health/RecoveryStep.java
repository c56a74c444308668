package in.pairguard.application.health;

/**
 * Steps of the recovery sequence, in execution order.
 */
public enum RecoveryStep {
    DISCONNECT,
    RECONNECT,
    REQUEST_CODE
}

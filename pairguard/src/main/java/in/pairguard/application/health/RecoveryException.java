package in.pairguard.application.health;

/**
 * Exception raised when a step of the recovery sequence fails.
 */
public class RecoveryException extends RuntimeException {

    private final RecoveryStep step;

    public RecoveryException(RecoveryStep step, String message) {
        super(String.format("[%s] %s", step, message));
        this.step = step;
    }

    public RecoveryException(RecoveryStep step, String message, Throwable cause) {
        super(String.format("[%s] %s", step, message), cause);
        this.step = step;
    }

    public RecoveryStep getStep() {
        return step;
    }
}

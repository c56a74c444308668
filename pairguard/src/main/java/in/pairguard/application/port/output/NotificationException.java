package in.pairguard.application.port.output;

/**
 * Exception thrown when the operator channel rejects or cannot deliver a message.
 */
public class NotificationException extends RuntimeException {

    private final String target;

    public NotificationException(String target, String message) {
        super(String.format("[%s] %s", target, message));
        this.target = target;
    }

    public NotificationException(String target, String message, Throwable cause) {
        super(String.format("[%s] %s", target, message), cause);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}

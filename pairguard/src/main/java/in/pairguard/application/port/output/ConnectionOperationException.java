package in.pairguard.application.port.output;

/**
 * Exception thrown when an operation on the watched connection fails.
 */
public class ConnectionOperationException extends RuntimeException {

    private final String operation;

    public ConnectionOperationException(String operation, String message) {
        super(String.format("[%s] %s", operation, message));
        this.operation = operation;
    }

    public ConnectionOperationException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}

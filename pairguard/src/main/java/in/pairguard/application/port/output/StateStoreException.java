package in.pairguard.application.port.output;

/**
 * Exception thrown when the key/value store cannot be read or written.
 */
public class StateStoreException extends RuntimeException {

    private final String key;

    public StateStoreException(String key, String message, Throwable cause) {
        super(String.format("[%s] %s", key, message), cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}

package in.pairguard.application.port.output;

/**
 * The long-lived, device-paired messaging connection the supervisor watches.
 *
 * Operations signal failure with {@link ConnectionOperationException}.
 */
public interface WatchedConnection {

    /**
     * Point-in-time liveness read. Must not throw; an unreachable connection is not ready.
     */
    boolean isReady();

    /**
     * Tear down the connection and flush its session.
     */
    void disconnect();

    /**
     * Re-initialise the socket so a pairing code can be requested.
     */
    void connect();

    /**
     * Request a fresh pairing code for the given identity.
     *
     * @param identity phone number in international format
     * @return raw pairing code as issued by the remote service
     */
    String requestPairingCode(String identity);
}

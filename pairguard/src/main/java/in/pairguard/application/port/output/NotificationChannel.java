package in.pairguard.application.port.output;

/**
 * Direct-message channel to a human operator.
 *
 * Operations signal failure with {@link NotificationException}.
 */
public interface NotificationChannel {

    /**
     * Open (or reuse) a direct conversation with the target.
     *
     * @param target operator address
     * @return handle of the conversation to post into
     */
    String openConversation(String target);

    /**
     * Post a formatted message into an open conversation.
     */
    void postMessage(String channelHandle, String text);
}

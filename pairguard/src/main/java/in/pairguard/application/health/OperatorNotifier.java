package in.pairguard.application.health;

import in.pairguard.application.port.output.NotificationChannel;
import in.pairguard.application.port.output.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Sends a new pairing code to the operator over a direct channel.
 *
 * Never throws: a failed delivery is logged, reported through
 * {@link SupervisorListener#onError} and answered with {@code false}.
 */
public class OperatorNotifier {
    private static final Logger log = LoggerFactory.getLogger(OperatorNotifier.class);

    private final NotificationChannel channel;
    private final SupervisorEvents events;

    /**
     * @param channel operator channel, or null when none is configured
     * @param events  signal sink for delivery failures
     */
    public OperatorNotifier(NotificationChannel channel, SupervisorEvents events) {
        this.channel = channel;
        this.events = events;
    }

    /**
     * Notify the operator of a pairing code.
     *
     * @param target      operator address
     * @param pairingCode formatted pairing code
     * @param waitWindow  how long the supervisor waits before requesting another code
     * @return true if the message was posted
     */
    public boolean notify(String target, String pairingCode, Duration waitWindow) {
        if (channel == null) {
            log.warn("[Notifier] No notification channel configured - cannot send pairing notification");
            return false;
        }
        if (target == null || target.isBlank()) {
            log.warn("[Notifier] No operator target configured - cannot send pairing notification");
            return false;
        }

        try {
            String channelHandle = channel.openConversation(target);
            if (channelHandle == null || channelHandle.isBlank()) {
                throw new NotificationException(target, "Failed to open direct conversation");
            }

            channel.postMessage(channelHandle, formatMessage(pairingCode, waitWindow));

            log.info("[Notifier] Pairing notification sent to {} (channel {})",
                PairingCodeFormatter.maskTarget(target), channelHandle);
            return true;

        } catch (Exception e) {
            log.error("[Notifier] Failed to send pairing notification to {}: {}",
                PairingCodeFormatter.maskTarget(target), e.getMessage());
            events.onError(e);
            return false;
        }
    }

    /**
     * Operator-facing message with the code, linking steps and the waiting window.
     */
    static String formatMessage(String pairingCode, Duration waitWindow) {
        return ":warning: *WhatsApp Connection Lost*\n"
            + "\n"
            + "The WhatsApp bot connection is unhealthy and needs re-pairing.\n"
            + "\n"
            + "*Pairing Code:* `" + pairingCode + "`\n"
            + "\n"
            + "*Steps to pair:*\n"
            + "1. Open WhatsApp on your phone\n"
            + "2. Go to Settings → Linked Devices\n"
            + "3. Tap \"Link a Device\"\n"
            + "4. Enter the code above\n"
            + "\n"
            + "_This code expires in a few minutes. The health monitor will wait up to "
            + PairingCodeFormatter.describeWindow(waitWindow)
            + " for you to pair before requesting a new code._";
    }
}

package in.pairguard.application.health;

import in.pairguard.domain.health.HealthStatus;
import in.pairguard.domain.health.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans supervisor signals out to registered listeners.
 *
 * A listener that throws is logged and skipped; the remaining listeners still run.
 */
public final class SupervisorEvents implements SupervisorListener {
    private static final Logger log = LoggerFactory.getLogger(SupervisorEvents.class);

    private final List<SupervisorListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(SupervisorListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(SupervisorListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void onHealthCheck(HealthStatus status) {
        fire("health_check", l -> l.onHealthCheck(status));
    }

    @Override
    public void onHealthy() {
        fire("healthy", SupervisorListener::onHealthy);
    }

    @Override
    public void onUnhealthy(int consecutiveFailures) {
        fire("unhealthy", l -> l.onUnhealthy(consecutiveFailures));
    }

    @Override
    public void onPairingRequested(String code) {
        fire("pairing_requested", l -> l.onPairingRequested(code));
    }

    @Override
    public void onPairingNotificationSent(String target) {
        fire("pairing_notification_sent", l -> l.onPairingNotificationSent(target));
    }

    @Override
    public void onPairingSkipped(SkipReason reason) {
        fire("pairing_skipped", l -> l.onPairingSkipped(reason));
    }

    @Override
    public void onError(Throwable error) {
        fire("error", l -> l.onError(error));
    }

    private void fire(String signal, Consumer<SupervisorListener> callback) {
        for (SupervisorListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (Exception e) {
                log.error("[Events] Listener {} threw on {}", listener.getClass().getSimpleName(), signal, e);
            }
        }
    }
}

package in.pairguard.application.health;

import in.pairguard.application.port.output.WatchedConnection;
import in.pairguard.config.SupervisorConfig;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.SupervisorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Drives the watched connection through disconnect, reconnect and a fresh pairing code.
 *
 * Sequence:
 * <pre>
 * 1. disconnect            (failure aborts)
 * 2. wait disconnect grace
 * 3. connect, wait reconnect grace
 * 4. request pairing code for the recovery identity
 * 5. success: persist pairing_requested, then notify the operator
 * 6. failure: persist cooldown, report the error, no notification
 * </pre>
 *
 * Not thread-safe on its own; the scheduler guarantees a single caller at a time.
 */
public class RecoveryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    public static final Duration DISCONNECT_GRACE = Duration.ofSeconds(2);
    public static final Duration RECONNECT_GRACE = Duration.ofSeconds(3);

    private final WatchedConnection connection;
    private final OperatorNotifier notifier;
    private final SupervisorStateRepository stateRepository;
    private final SupervisorEvents events;
    private final SupervisorConfig config;
    private final Clock clock;
    private final Duration disconnectGrace;
    private final Duration reconnectGrace;

    public RecoveryOrchestrator(WatchedConnection connection,
                                OperatorNotifier notifier,
                                SupervisorStateRepository stateRepository,
                                SupervisorEvents events,
                                SupervisorConfig config,
                                Clock clock) {
        this(connection, notifier, stateRepository, events, config, clock, DISCONNECT_GRACE, RECONNECT_GRACE);
    }

    public RecoveryOrchestrator(WatchedConnection connection,
                                OperatorNotifier notifier,
                                SupervisorStateRepository stateRepository,
                                SupervisorEvents events,
                                SupervisorConfig config,
                                Clock clock,
                                Duration disconnectGrace,
                                Duration reconnectGrace) {
        this.connection = connection;
        this.notifier = notifier;
        this.stateRepository = stateRepository;
        this.events = events;
        this.config = config;
        this.clock = clock;
        this.disconnectGrace = disconnectGrace;
        this.reconnectGrace = reconnectGrace;
    }

    /**
     * Run one recovery attempt.
     *
     * @param state current state; its pairing state is replaced by the outcome
     * @return the resulting state and, on success, the formatted code
     */
    public RecoveryResult recover(SupervisorState state) {
        log.info("[Recovery] Triggering automatic pairing process");

        String rawCode;
        try {
            log.info("[Recovery] Disconnecting and flushing session...");
            runStep(RecoveryStep.DISCONNECT, connection::disconnect);
            pause(RecoveryStep.DISCONNECT, disconnectGrace);

            log.info("[Recovery] Reconnecting to initialize socket...");
            runStep(RecoveryStep.RECONNECT, connection::connect);
            pause(RecoveryStep.RECONNECT, reconnectGrace);

            log.info("[Recovery] Requesting pairing code...");
            rawCode = requestPairingCode();

        } catch (RecoveryException e) {
            return fail(state, e);
        }

        String formattedCode = PairingCodeFormatter.format(rawCode);
        SupervisorState requested = state.enter(PairingState.PAIRING_REQUESTED, clock.instant());
        stateRepository.save(requested);

        log.info("[Recovery] Pairing code generated (length {}), waiting up to {} for the operator to pair",
            rawCode.length(), PairingCodeFormatter.describeWindow(config.maxPairingWait()));
        events.onPairingRequested(formattedCode);

        boolean notified = notifier.notify(config.notifyTarget(), formattedCode, config.maxPairingWait());
        if (notified) {
            events.onPairingNotificationSent(config.notifyTarget());
        }

        return RecoveryResult.succeeded(requested, formattedCode, notified);
    }

    private RecoveryResult fail(SupervisorState state, RecoveryException error) {
        Instant now = clock.instant();
        SupervisorState cooled = state.enter(PairingState.COOLDOWN, now);
        stateRepository.save(cooled);

        log.error("[Recovery] Failed to trigger pairing: {}", error.getMessage(), error);
        log.info("[Recovery] Entering cooldown after failed pairing attempt ({})",
            PairingCodeFormatter.describeWindow(config.cooldown()));
        events.onError(error);

        return RecoveryResult.failed(cooled, error);
    }

    private String requestPairingCode() {
        String identity = PairingCodeFormatter.digitsOnly(config.recoveryIdentity());
        if (identity.length() < 10 || identity.length() > 15) {
            throw new RecoveryException(RecoveryStep.REQUEST_CODE,
                "Invalid recovery identity: expected 10-15 digits in international format");
        }

        log.debug("[Recovery] Requesting pairing code for {}", PairingCodeFormatter.maskIdentity(identity));

        String code;
        try {
            code = connection.requestPairingCode(identity);
        } catch (RuntimeException e) {
            throw new RecoveryException(RecoveryStep.REQUEST_CODE, "Pairing code request failed: " + e.getMessage(), e);
        }

        if (code == null || code.isBlank()) {
            throw new RecoveryException(RecoveryStep.REQUEST_CODE, "Connection returned an empty pairing code");
        }
        return code;
    }

    private void runStep(RecoveryStep step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            throw new RecoveryException(step, "Step failed: " + e.getMessage(), e);
        }
    }

    private void pause(RecoveryStep step, Duration grace) {
        if (grace.isZero() || grace.isNegative()) {
            return;
        }
        try {
            Thread.sleep(grace.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RecoveryException(step, "Interrupted during grace period", e);
        }
    }
}

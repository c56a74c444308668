package in.pairguard.application.health;

import in.pairguard.application.port.output.KeyValueStore;
import in.pairguard.domain.health.PairingState;
import in.pairguard.domain.health.SupervisorState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Best-effort persistence of {@link SupervisorState} in a {@link KeyValueStore}.
 *
 * A failed read yields the initial state; a failed write is logged and the caller
 * keeps operating from memory until the next successful save.
 */
public final class SupervisorStateRepository {
    private static final Logger log = LoggerFactory.getLogger(SupervisorStateRepository.class);

    public static final String KEY_PAIRING_STATE = "pairing_state";
    public static final String KEY_LAST_PAIRING_REQUEST = "last_pairing_request_time";
    public static final String KEY_CONSECUTIVE_FAILURES = "consecutive_failures";

    private final KeyValueStore store;

    public SupervisorStateRepository(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Load the persisted state, or the initial state if nothing can be read.
     */
    public SupervisorState load() {
        try {
            Optional<String> pairingState = store.get(KEY_PAIRING_STATE);
            Optional<String> lastRequest = store.get(KEY_LAST_PAIRING_REQUEST);
            Optional<String> failures = store.get(KEY_CONSECUTIVE_FAILURES);

            SupervisorState state = new SupervisorState(
                pairingState.map(this::parsePairingState).orElse(PairingState.IDLE),
                failures.map(this::parseFailures).orElse(0),
                lastRequest.map(this::parseInstant).orElse(null),
                null,
                null
            );

            log.info("[StateStore] Loaded persisted state: pairingState={}, lastPairingRequestTime={}, consecutiveFailures={}",
                state.pairingState().code(), state.lastPairingRequestTime(), state.consecutiveFailures());
            return state;

        } catch (RuntimeException e) {
            log.warn("[StateStore] Failed to load persisted state, starting fresh: {}", e.getMessage());
            return SupervisorState.initial();
        }
    }

    /**
     * Write the persistent fields of a state.
     *
     * @return true if every key was written
     */
    public boolean save(SupervisorState state) {
        try {
            store.set(KEY_PAIRING_STATE, state.pairingState().code());

            if (state.lastPairingRequestTime() != null) {
                store.set(KEY_LAST_PAIRING_REQUEST, state.lastPairingRequestTime().toString());
            } else {
                store.delete(KEY_LAST_PAIRING_REQUEST);
            }

            store.set(KEY_CONSECUTIVE_FAILURES, String.valueOf(state.consecutiveFailures()));
            return true;

        } catch (RuntimeException e) {
            log.warn("[StateStore] Failed to persist state: {}", e.getMessage());
            return false;
        }
    }

    private PairingState parsePairingState(String value) {
        try {
            return PairingState.fromCode(value.trim());
        } catch (IllegalArgumentException e) {
            log.warn("[StateStore] Ignoring unknown persisted pairing state '{}'", value);
            return PairingState.IDLE;
        }
    }

    private int parseFailures(String value) {
        try {
            return Math.max(0, Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("[StateStore] Ignoring unparsable consecutive failure count '{}'", value);
            return 0;
        }
    }

    private Instant parseInstant(String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            log.warn("[StateStore] Ignoring unparsable pairing request time '{}'", value);
            return null;
        }
    }
}

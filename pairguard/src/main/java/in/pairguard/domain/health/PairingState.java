package in.pairguard.domain.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pairing lifecycle of the watched connection.
 */
public enum PairingState {
    /**
     * Normal operation. No recovery in flight and no cooldown window open.
     */
    IDLE("idle"),

    /**
     * A pairing code was sent to the operator; waiting for them to link the device.
     */
    PAIRING_REQUESTED("pairing_requested"),

    /**
     * A recovery attempt failed; new attempts are held back until the cooldown elapses.
     */
    COOLDOWN("cooldown");

    private final String code;

    PairingState(String code) {
        this.code = code;
    }

    /**
     * Stable string form used for persistence and JSON.
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Parse the persisted form.
     *
     * @throws IllegalArgumentException for an unknown code
     */
    public static PairingState fromCode(String code) {
        for (PairingState state : values()) {
            if (state.code.equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown pairing state: " + code);
    }
}

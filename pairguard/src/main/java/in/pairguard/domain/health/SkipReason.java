package in.pairguard.domain.health;

/**
 * Why an unhealthy tick did not count toward recovery.
 */
public enum SkipReason {
    WAITING_FOR_USER("waiting_for_user"),
    COOLDOWN("cooldown");

    private final String code;

    SkipReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}

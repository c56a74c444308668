package in.pairguard.application.health;

import java.time.Duration;

/**
 * Human-readable forms of pairing codes, identities and waiting windows.
 */
public final class PairingCodeFormatter {

    private static final int GROUPED_CODE_LENGTH = 8;

    private PairingCodeFormatter() {}

    /**
     * Format an 8-character code as {@code ABCD-1234}; other codes pass through trimmed.
     */
    public static String format(String rawCode) {
        if (rawCode == null) {
            return "";
        }
        String code = rawCode.trim();
        if (code.length() == GROUPED_CODE_LENGTH) {
            return code.substring(0, 4) + "-" + code.substring(4);
        }
        return code;
    }

    /**
     * Strip everything but digits from a phone number.
     */
    public static String digitsOnly(String identity) {
        return identity == null ? "" : identity.replaceAll("\\D", "");
    }

    /**
     * Mask a phone number for logs: first 5 digits, rest hidden.
     */
    public static String maskIdentity(String identity) {
        String digits = digitsOnly(identity);
        if (digits.length() <= 5) {
            return "***";
        }
        return digits.substring(0, 5) + "***";
    }

    /**
     * Mask an operator address for logs: first 4 characters, rest hidden.
     */
    public static String maskTarget(String target) {
        if (target == null || target.isEmpty()) {
            return "NOT SET";
        }
        return target.length() <= 4 ? target + "..." : target.substring(0, 4) + "...";
    }

    /**
     * Describe a waiting window as whole hours, or minutes below one hour.
     */
    public static String describeWindow(Duration window) {
        if (window.compareTo(Duration.ofHours(1)) >= 0) {
            long hours = Math.round(window.toMinutes() / 60.0);
            return hours + (hours == 1 ? " hour" : " hours");
        }
        long minutes = Math.max(1, window.toMinutes());
        return minutes + (minutes == 1 ? " minute" : " minutes");
    }
}

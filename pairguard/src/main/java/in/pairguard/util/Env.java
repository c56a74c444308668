package in.pairguard.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Environment variable utilities.
 *
 * A variable that is unset or blank falls back to the system property of the same
 * name, then to the supplied default. Unparsable numbers are logged and ignored.
 */
public final class Env {
    private static final Logger log = LoggerFactory.getLogger(Env.class);

    public static String get(String key, String defaultValue) {
        String value = lookup(key);
        return value != null ? value : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        return parse(key, defaultValue, Integer::parseInt);
    }

    /**
     * Read a duration given in milliseconds.
     */
    public static Duration getMillis(String key, Duration defaultValue) {
        return parse(key, defaultValue, value -> Duration.ofMillis(Long.parseLong(value)));
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = lookup(key);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    private static String lookup(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static <T> T parse(String key, T defaultValue, Function<String, T> parser) {
        String value = lookup(key);
        if (value == null) return defaultValue;
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparsable {}='{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private Env() {}
}

package in.backtestnet.util;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Environment lookups. Environment variables win over system properties.
 */
public final class Env {

    public static String get(String key, String defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    public static int getInt(String key, int defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public static boolean getBool(String key, boolean defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        return "true".equalsIgnoreCase(value) || "1".equals(value);
    }

    /**
     * ISO-8601 instant, e.g. {@code 2023-01-01T00:00:00Z}.
     */
    public static Instant getInstant(String key, Instant defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Invalid instant for " + key + ": " + value, e);
        }
    }

    public static <E extends Enum<E>> E getEnum(String key, Class<E> type, E defaultValue) {
        String value = get(key, null);
        if (value == null) return defaultValue;
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid " + type.getSimpleName() + " for " + key + ": " + value, e);
        }
    }

    private Env() {}
}

package io.deadswitch.util;

import java.util.Locale;

/**
 * Named settings for SwitchConfig. A non-empty environment variable wins over a
 * system property of the same name. Empty values count as unset, and values
 * that do not parse fall back to the caller's default.
 */
public final class Env {

    private Env() {}

    public static String get(String key, String defaultValue) {
        String fromEnv = System.getenv(key);
        if (fromEnv != null && !fromEnv.isEmpty()) {
            return fromEnv;
        }
        String fromProperty = System.getProperty(key);
        return fromProperty == null || fromProperty.isEmpty() ? defaultValue : fromProperty;
    }

    public static int getInt(String key, int defaultValue) {
        long value = getLong(key, defaultValue);
        return value == (int) value ? (int) value : defaultValue;
    }

    public static long getLong(String key, long defaultValue) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** "true" in any case, or "1". */
    public static boolean getBool(String key, boolean defaultValue) {
        String raw = get(key, null);
        if (raw == null) {
            return defaultValue;
        }
        String flag = raw.trim().toLowerCase(Locale.ROOT);
        return flag.equals("true") || flag.equals("1");
    }
}

package com.acme.ringqueue.util;

import java.util.Map;

/**
 * Environment parsing helpers with consistent defaulting and clamping.
 *
 * <p>Every lookup has a {@link Map}-based overload so callers and tests can
 * supply their own environment.</p>
 */
public final class EnvVars {
    private EnvVars() {
    }

    public static boolean getBoolean(String name, boolean defaultValue) {
        return getBoolean(System.getenv(), name, defaultValue);
    }

    public static int getIntClamped(String name, int defaultValue, int min, int max) {
        return getIntClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static long getLongClamped(String name, long defaultValue, long min, long max) {
        return getLongClamped(System.getenv(), name, defaultValue, min, max);
    }

    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String v = env.get(name);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(v.trim());
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        return (int) getLongClamped(env, name, defaultValue, min, max);
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(raw.trim());
            if (parsed < min) return min;
            return Math.min(parsed, max);
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }
}

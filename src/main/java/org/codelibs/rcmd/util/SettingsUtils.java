package org.codelibs.rcmd.util;

import java.util.Map;

public final class SettingsUtils {
    private SettingsUtils() {
    }

    public static <T, V> T get(final Map<String, V> settings, final String key) {
        return get(settings, key, null);
    }

    @SuppressWarnings("unchecked")
    public static <T, V> T get(final Map<String, V> settings, final String key,
            final T defaultValue) {
        if (settings != null) {
            final V value = settings.get(key);
            if (value != null) {
                return (T) value;
            }
        }
        return defaultValue;
    }

    public static <V> int getInt(final Map<String, V> settings,
            final String key, final int defaultValue) {
        final Object value = get(settings, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": "
                    + value, e);
        }
    }

    public static <V> double getDouble(final Map<String, V> settings,
            final String key, final double defaultValue) {
        final Object value = get(settings, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + key + ": "
                    + value, e);
        }
    }

    public static <V> String getString(final Map<String, V> settings,
            final String key, final String defaultValue) {
        final Object value = get(settings, key);
        return value == null ? defaultValue : value.toString();
    }
}

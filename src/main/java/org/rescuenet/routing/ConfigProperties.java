package org.rescuenet.routing;

import lombok.experimental.UtilityClass;

import java.util.Properties;

/**
 * Typed lookups for {@code rescuenet.*} configuration keys.
 *
 * <p>A JVM system property with the same key wins over the supplied properties, so a deployment can
 * override a packaged {@code rescuenet.properties} with {@code -D} flags.</p>
 */
@UtilityClass
public class ConfigProperties {

    public static String stringValue(Properties properties, String key, String defaultValue) {
        String raw = raw(properties, key);
        return raw == null ? defaultValue : raw;
    }

    public static int intValue(Properties properties, String key, int defaultValue) {
        String raw = raw(properties, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("property " + key + " is not an integer: " + raw, ex);
        }
    }

    public static long longValue(Properties properties, String key, long defaultValue) {
        String raw = raw(properties, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("property " + key + " is not a long: " + raw, ex);
        }
    }

    public static double doubleValue(Properties properties, String key, double defaultValue) {
        String raw = raw(properties, key);
        if (raw == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("property " + key + " is not a number: " + raw, ex);
        }
    }

    public static boolean booleanValue(Properties properties, String key, boolean defaultValue) {
        String raw = raw(properties, key);
        if (raw == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(raw)) {
            return true;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return false;
        }
        throw new IllegalArgumentException("property " + key + " is not a boolean: " + raw);
    }

    private static String raw(Properties properties, String key) {
        String value = System.getProperty(key);
        if ((value == null || value.isBlank()) && properties != null) {
            value = properties.getProperty(key);
        }
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}

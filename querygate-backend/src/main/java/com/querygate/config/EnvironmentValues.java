package com.querygate.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

/**
 * Reads settings from the Spring environment, falling back to an upper-snake environment variable
 * name when the property is not set.
 */
@Slf4j
public final class EnvironmentValues {

    private EnvironmentValues() {
    }

    public static String getTrimmed(Environment environment, String propKey, String envKey) {
        String v = null;
        if (environment != null && propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment != null ? environment.getProperty(envKey) : null;
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }

    public static String getString(Environment environment, String propKey, String envKey, String defaultValue) {
        String v = getTrimmed(environment, propKey, envKey);
        return v == null || v.isBlank() ? defaultValue : v;
    }

    public static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid integer setting (key={}, value={})", propKey, raw);
            return defaultValue;
        }
    }

    public static long getLong(Environment environment, String propKey, String envKey, long defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid long setting (key={}, value={})", propKey, raw);
            return defaultValue;
        }
    }

    public static double getDouble(Environment environment, String propKey, String envKey, double defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid decimal setting (key={}, value={})", propKey, raw);
            return defaultValue;
        }
    }
}

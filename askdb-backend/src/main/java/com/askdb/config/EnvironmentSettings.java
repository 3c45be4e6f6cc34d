package com.askdb.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;

/**
 * Property lookup with an environment-variable fallback: {@code askdb.pool.max-size} first,
 * then {@code ASKDB_POOL_MAX_SIZE}.
 */
@Slf4j
public final class EnvironmentSettings {

    private EnvironmentSettings() {
    }

    /**
     * Read a trimmed value.
     *
     * @param environment Spring environment, may be null
     * @param propKey property key
     * @param envKey environment variable name
     * @return trimmed value, or null when neither key is set
     */
    public static String getTrimmed(Environment environment, String propKey, String envKey) {
        if (environment == null) {
            return null;
        }
        String v = null;
        if (propKey != null && !propKey.isBlank()) {
            v = environment.getProperty(propKey);
        }
        if ((v == null || v.isBlank()) && envKey != null && !envKey.isBlank()) {
            v = environment.getProperty(envKey);
        }
        if (v == null) {
            return null;
        }
        return v.trim();
    }

    public static int getInt(Environment environment, String propKey, String envKey, int defaultValue) {
        return (int) getLong(environment, propKey, envKey, defaultValue);
    }

    public static long getLong(Environment environment, String propKey, String envKey, long defaultValue) {
        String raw = getTrimmed(environment, propKey, envKey);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric value for {} ({}); using default {}", propKey, raw, defaultValue);
            return defaultValue;
        }
    }
}

package com.sandguard.common.infra;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Environment variable utilities: boolean parsing and defaulted lookups.
 * <p>
 * Every lookup takes the environment as a map so callers can resolve
 * settings once from {@link System#getenv()} and tests can pass their own.
 */
public final class EnvUtils {

    private EnvUtils() {
    }

    private static final Logger log = LoggerFactory.getLogger(EnvUtils.class);
    private static final Set<String> TRUTHY_VALUES = Set.of("1", "true", "yes", "y", "on");
    private static final Set<String> FALSY_VALUES = Set.of("0", "false", "no", "n", "off");

    /**
     * Parse a boolean value (true/false/null for unknown).
     */
    public static Boolean parseBoolean(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String lower = value.trim().toLowerCase();
        if (TRUTHY_VALUES.contains(lower))
            return true;
        if (FALSY_VALUES.contains(lower))
            return false;
        return null;
    }

    /**
     * Get an environment variable with a default. Blank values count as unset.
     */
    public static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String value = env != null ? env.get(key) : null;
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    /**
     * Get an environment variable as boolean. Unrecognised values fall back to
     * the default.
     */
    public static boolean getEnvBoolean(Map<String, String> env, String key, boolean defaultValue) {
        String raw = env != null ? env.get(key) : null;
        Boolean parsed = parseBoolean(raw);
        if (parsed == null && raw != null && !raw.isBlank()) {
            log.warn("env: ignoring unrecognised boolean {}={}, using {}", key, raw.trim(), defaultValue);
        }
        return parsed != null ? parsed : defaultValue;
    }
}

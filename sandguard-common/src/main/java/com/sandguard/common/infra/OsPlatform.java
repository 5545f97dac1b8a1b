package com.sandguard.common.infra;

import java.util.Locale;

/**
 * Host operating system families the enforcer distinguishes between.
 */
public enum OsPlatform {
    LINUX, DARWIN, WINDOWS, OTHER;

    /**
     * Detect the platform of the running JVM.
     */
    public static OsPlatform current() {
        return fromOsName(System.getProperty("os.name", "unknown"));
    }

    /**
     * Map a {@code os.name}-style string (or a {@code platform.system()}-style
     * name such as "Darwin") onto a platform.
     */
    public static OsPlatform fromOsName(String osName) {
        if (osName == null) {
            return OTHER;
        }
        String lower = osName.trim().toLowerCase(Locale.ROOT);
        if (lower.contains("mac") || lower.contains("darwin")) {
            return DARWIN;
        }
        if (lower.contains("win")) {
            return WINDOWS;
        }
        if (lower.contains("linux")) {
            return LINUX;
        }
        return OTHER;
    }
}

package com.sandguard.common.logging;

/**
 * Log levels understood by {@link SubsystemLogger}.
 */
public enum LogLevel {
    ERROR,
    WARN,
    INFO,
    DEBUG,
    TRACE
}

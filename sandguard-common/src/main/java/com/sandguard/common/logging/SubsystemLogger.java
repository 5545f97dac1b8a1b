package com.sandguard.common.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Map;

/**
 * Subsystem-aware logger that wraps SLF4J and adds structured subsystem
 * context.
 *
 * <p>
 * Usage:
 *
 * <pre>
 * SubsystemLogger log = SubsystemLogger.create("sandbox/audit");
 * log.log(LogLevel.INFO, "Command classified", Map.of("classification", "SAFE"));
 * </pre>
 */
public class SubsystemLogger {

    static final String MDC_SUBSYSTEM = "subsystem";

    private final String subsystem;
    private final Logger logger;

    private SubsystemLogger(String subsystem) {
        this.subsystem = subsystem;
        // Subsystem doubles as the SLF4J logger name for per-subsystem control in
        // logback.xml
        this.logger = LoggerFactory.getLogger("sandguard." + subsystem.replace('/', '.'));
    }

    /**
     * Create a subsystem logger.
     */
    public static SubsystemLogger create(String subsystem) {
        return new SubsystemLogger(subsystem);
    }

    // -----------------------------------------------------------------------
    // Log methods
    // -----------------------------------------------------------------------

    /**
     * Emit a message at an explicit level with the subsystem bound in the MDC.
     */
    public void log(LogLevel level, String message, Map<String, Object> meta) {
        try {
            MDC.put(MDC_SUBSYSTEM, subsystem);
            String formatted = formatMessage(message, meta);
            switch (level) {
                case TRACE -> logger.trace(formatted);
                case DEBUG -> logger.debug(formatted);
                case INFO -> logger.info(formatted);
                case WARN -> logger.warn(formatted);
                case ERROR -> logger.error(formatted);
            }
        } finally {
            MDC.remove(MDC_SUBSYSTEM);
        }
    }

    // -----------------------------------------------------------------------
    // Internals
    // -----------------------------------------------------------------------

    String formatMessage(String message, Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return "[" + subsystem + "] " + message;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("[").append(subsystem).append("] ").append(message);
        sb.append(" {");
        boolean first = true;
        for (var entry : meta.entrySet()) {
            if (!first)
                sb.append(", ");
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }
        sb.append("}");
        return sb.toString();
    }
}

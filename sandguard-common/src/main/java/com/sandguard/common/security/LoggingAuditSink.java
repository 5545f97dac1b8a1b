package com.sandguard.common.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandguard.common.logging.LogLevel;
import com.sandguard.common.logging.SubsystemLogger;
import com.sandguard.common.security.SecurityAuditTypes.AuditEvent;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit sink that writes each event as a single JSON line through SLF4J, at a
 * log level matching the event severity. Route the {@code sandguard.audit}
 * logger to a dedicated appender to persist the trail.
 */
public class LoggingAuditSink implements AuditSink {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SubsystemLogger log;

    public LoggingAuditSink() {
        this(SubsystemLogger.create("audit"));
    }

    public LoggingAuditSink(SubsystemLogger log) {
        this.log = log;
    }

    @Override
    public void record(AuditEvent event) {
        Map<String, Object> payload = toPayload(event);
        LogLevel level = switch (event.severity()) {
            case INFO -> LogLevel.INFO;
            case WARN -> LogLevel.WARN;
            case ERROR -> LogLevel.ERROR;
        };
        try {
            log.log(level, MAPPER.writeValueAsString(payload), null);
        } catch (JsonProcessingException e) {
            // Fall back to key=value rendering so the decision still reaches the trail
            log.log(level, event.operation(), payload);
        }
    }

    static Map<String, Object> toPayload(AuditEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.ofEpochMilli(event.timestamp()).toString());
        payload.put("event_type", event.operation());
        payload.put("severity", event.severity().name().toLowerCase());
        payload.put("command", event.command());
        if (event.reason() != null) {
            payload.put("reason", event.reason());
        }
        if (event.profile() != null) {
            payload.put("profile", event.profile());
        }
        return payload;
    }
}

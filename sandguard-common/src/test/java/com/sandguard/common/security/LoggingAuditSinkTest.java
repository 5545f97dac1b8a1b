package com.sandguard.common.security;

import com.sandguard.common.security.SecurityAuditTypes.AuditEvent;
import com.sandguard.common.security.SecurityAuditTypes.Severity;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingAuditSinkTest {

    @Test
    void payloadCarriesDecisionFields() {
        AuditEvent event = new AuditEvent(0L, "sandbox_classify", "rm -rf /",
                Severity.WARN, "Matched blocked pattern: rm -rf", "development");

        Map<String, Object> payload = LoggingAuditSink.toPayload(event);

        assertEquals("1970-01-01T00:00:00Z", payload.get("timestamp"));
        assertEquals("sandbox_classify", payload.get("event_type"));
        assertEquals("warn", payload.get("severity"));
        assertEquals("rm -rf /", payload.get("command"));
        assertEquals("Matched blocked pattern: rm -rf", payload.get("reason"));
        assertEquals("development", payload.get("profile"));
    }

    @Test
    void payloadOmitsAbsentReason() {
        AuditEvent event = AuditEvent.now("sandbox_classify", "ls", Severity.INFO, null, null);

        Map<String, Object> payload = LoggingAuditSink.toPayload(event);

        assertFalse(payload.containsKey("reason"));
        assertFalse(payload.containsKey("profile"));
    }

    @Test
    void recordAcceptsEverySeverity() {
        LoggingAuditSink sink = new LoggingAuditSink();
        for (Severity severity : Severity.values()) {
            assertDoesNotThrow(() -> sink.record(
                    AuditEvent.now("sandbox_classify", "ls", severity, "r", "p")));
        }
    }
}

package com.sandguard.common.security;

import java.util.Objects;

/**
 * Type definitions for security audit events emitted by the enforcer.
 */
public final class SecurityAuditTypes {

    private SecurityAuditTypes() {
    }

    // -----------------------------------------------------------------------
    // Severity
    // -----------------------------------------------------------------------

    public enum Severity {
        INFO, WARN, ERROR
    }

    // -----------------------------------------------------------------------
    // Event
    // -----------------------------------------------------------------------

    /**
     * One audit record: a classification decision or a circuit-breaker trip.
     *
     * @param timestamp epoch millis at which the decision was taken
     * @param operation event kind, e.g. {@code sandbox_classify}
     * @param command   the command the decision is about
     * @param severity  event severity
     * @param reason    human-readable reason, may be null for SAFE decisions
     * @param profile   active policy profile, may be null
     */
    public record AuditEvent(
            long timestamp,
            String operation,
            String command,
            Severity severity,
            String reason,
            String profile) {

        public AuditEvent {
            Objects.requireNonNull(operation, "operation");
            Objects.requireNonNull(severity, "severity");
        }

        public static AuditEvent now(String operation, String command, Severity severity,
                String reason, String profile) {
            return new AuditEvent(System.currentTimeMillis(), operation, command, severity, reason, profile);
        }
    }
}

package com.sandguard.common.security;

import com.sandguard.common.security.SecurityAuditTypes.AuditEvent;

/**
 * Receives structured security events. Transport and persistence are up to the
 * implementation.
 */
@FunctionalInterface
public interface AuditSink {

    /**
     * Record one audit event.
     */
    void record(AuditEvent event);
}

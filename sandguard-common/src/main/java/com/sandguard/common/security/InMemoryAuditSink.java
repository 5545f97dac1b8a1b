package com.sandguard.common.security;

import com.sandguard.common.security.SecurityAuditTypes.AuditEvent;
import com.sandguard.common.security.SecurityAuditTypes.Severity;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audit sink that keeps events in memory. Suitable for tests and for callers
 * that inspect decisions after the fact.
 */
public class InMemoryAuditSink implements AuditSink {

    private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(AuditEvent event) {
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Snapshot of recorded events in arrival order.
     */
    public List<AuditEvent> getEvents() {
        return List.copyOf(events);
    }

    public List<AuditEvent> getEvents(Severity severity) {
        return events.stream().filter(e -> e.severity() == severity).toList();
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}

package com.example.dsr.access;

import com.example.dsr.models.AuditEvent;
import java.util.List;
import java.util.Optional;

/**
 * Storage abstraction for the append-only {@code dsr_audit_events} table. Implementations
 * persist events and return the latest event of a request so the service layer can extend
 * the hash chain.
 */
public interface AuditEventAccess {
    void put(AuditEvent event);

    Optional<AuditEvent> findLatest(long requestId);

    /**
     * All audit events of one request, oldest first.
     *
     * @param requestId the request whose trail is read
     * @return events in chain order
     */
    List<AuditEvent> findAllByRequestId(long requestId);

    /**
     * Finds all audit events with timestamp older than the specified cutoff.
     * Used for retention policy enforcement.
     *
     * @param cutoffTimestamp events with timestamp less than this will be returned
     * @return list of audit events older than cutoff
     */
    List<AuditEvent> findEventsOlderThan(long cutoffTimestamp);

    void delete(AuditEvent event);
}

package com.example.dsr.service;

import com.example.dsr.access.AuditEventAccess;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Appends lifecycle events to the per-request audit trail. Every event carries the hash of its
 * predecessor so tampering with the trail is detectable.
 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

    public static final String SYSTEM_ACTOR = "system";

    private static final String ZERO_HASH = "0".repeat(64);

    private final AuditEventAccess auditEventAccess;
    private final Clock clock;

    public void recordSubmitted(Request request) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("kind", request.getKind().value());
        details.put("subject_type", request.getSubjectType());
        if (request.getReason() != null) {
            details.put("reason", request.getReason());
        }
        append(request, request.getRequestedBy(), AuditEvent.EventType.REQUEST_SUBMITTED, null, details);
    }

    public void recordPlanGenerated(Request request, DeletionPlan plan) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("tables", plan.tablesToProcess().size());
        details.put("total_estimated_rows", plan.totalEstimatedRows());
        details.put("requires_approval", plan.requiresApproval());
        details.put("warnings", plan.warnings());
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.PLAN_GENERATED, null, details);
    }

    public void recordApproved(Request request, String approver) {
        append(request, approver, AuditEvent.EventType.APPROVED, null, null);
    }

    public void recordRejected(Request request, String approver, String reason) {
        append(request, approver, AuditEvent.EventType.REJECTED, null,
                reason == null ? null : Map.of("reason", reason));
    }

    public void recordCancelled(Request request, String actor, int itemsCancelled) {
        append(request, actor, AuditEvent.EventType.CANCELLED, null,
                Map.of("items_cancelled", itemsCancelled));
    }

    public void recordProcessingStarted(Request request) {
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.PROCESSING_STARTED, null, null);
    }

    public void recordItemCompleted(Request request, RequestItem item) {
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.ITEM_COMPLETED,
                item.tableRef().qualifiedName(),
                Map.of("affected_rows", item.getAffectedRows() == null ? 0L : item.getAffectedRows()));
    }

    public void recordItemFailed(Request request, RequestItem item, String errorMessage) {
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.ITEM_FAILED,
                item.tableRef().qualifiedName(),
                errorMessage == null ? null : Map.of("error", errorMessage));
    }

    public void recordCompleted(Request request, Map<String, Object> summary) {
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.REQUEST_COMPLETED, null, summary);
    }

    public void recordFailed(Request request, String errorMessage) {
        append(request, SYSTEM_ACTOR, AuditEvent.EventType.REQUEST_FAILED, null,
                errorMessage == null ? null : Map.of("error", errorMessage));
    }

    public List<AuditEvent> trail(long requestId) {
        return auditEventAccess.findAllByRequestId(requestId);
    }

    /**
     * Appends an audit event, maintaining the per-request hash chain.
     */
    private void append(Request request,
                        String actor,
                        AuditEvent.EventType type,
                        String tableRef,
                        Map<String, Object> details) {
        long now = clock.millis();
        Optional<AuditEvent> latest = auditEventAccess.findLatest(request.getRequestId());
        String prevHash = latest.map(AuditEvent::getHash).orElse(ZERO_HASH);
        long sortMillis = latest.map(e -> Math.max(now, sortKeyPart(e.getTsUlid(), 0))).orElse(now);
        long position = latest.map(e -> sortKeyPart(e.getTsUlid(), 1) + 1).orElse(1L);

        AuditEvent event = AuditEvent.builder()
                .requestId(request.getRequestId())
                .tsUlid(generateTimestampUlid(sortMillis, position))
                .eventType(type)
                .actor(actor)
                .timestamp(now)
                .prevHash(prevHash)
                .correlationId(request.getCorrelationId())
                .tableRef(tableRef)
                .details(details)
                .build();

        auditEventAccess.put(event);
    }

    /**
     * Zero-padded millis plus the event's position in the chain, so the sort key follows the
     * chain even when several events share a millisecond or the clock steps back.
     */
    static String generateTimestampUlid(long timestamp, long position) {
        return String.format("%013d_%06d", timestamp, position);
    }

    static long sortKeyPart(String tsUlid, int index) {
        String[] parts = tsUlid.split("_");
        try {
            return Long.parseLong(parts[index]);
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException ex) {
            throw new IllegalStateException("Malformed audit sort key: " + tsUlid, ex);
        }
    }
}

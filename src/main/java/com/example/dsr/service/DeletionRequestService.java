package com.example.dsr.service;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.discovery.DeletionPlanner;
import com.example.dsr.models.DeletionOptions;
import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.requests.ApproveDeletionServiceRequest;
import com.example.dsr.requests.CancelRequestServiceRequest;
import com.example.dsr.requests.RejectDeletionServiceRequest;
import com.example.dsr.requests.SubmitDeletionServiceRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Right-to-erasure requests. The deletion plan is computed while the caller waits and stored on
 * the request; execution starts right away only when the caller waived verification and the
 * plan raised no warning. Every other request waits in {@code pending} for an approver.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeletionRequestService {

    private final RequestAccess requestAccess;
    private final RequestLifecycle lifecycle;
    private final DeletionPlanner planner;
    private final RequestDispatcher dispatcher;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public Request submit(SubmitDeletionServiceRequest command) {
        Objects.requireNonNull(command, "command");
        DeletionOptions options = command.options();

        long now = clock.millis();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (command.notes() != null && !command.notes().isEmpty()) {
            metadata.put(Request.META_NOTES, command.notes());
        }
        metadata.put(Request.META_OPTIONS, RequestDocuments.toDocument(options));

        Request request = requestAccess.save(Request.builder()
                .requestId(requestAccess.nextRequestId())
                .kind(RequestKind.DELETE)
                .subjectType(command.subjectType())
                .subjectValue(command.subjectValue())
                .status(RequestStatus.PENDING)
                .requestedBy(command.requestedBy())
                .reason(command.reason())
                .correlationId(command.correlationId())
                .requestedAt(now)
                .updatedAt(now)
                .metadata(metadata)
                .build());
        log.info("Deletion request {} created for subject type {} by {}",
                request.getRequestId(), request.getSubjectType(), request.getRequestedBy());
        auditLogService.recordSubmitted(request);

        DeletionPlan plan;
        try {
            plan = planner.generatePlan(command.subjectType(), command.subjectValue());
        } catch (RuntimeException ex) {
            log.error("Failed to generate deletion plan for request {}: {}",
                    request.getRequestId(), ex.getMessage(), ex);
            Request latest = latest(request);
            Request failed = latest.toBuilder()
                    .status(RequestStatus.FAILED)
                    .updatedAt(clock.millis())
                    .metadata(latest.metadataWith(Request.META_FAILURE, String.valueOf(ex.getMessage())))
                    .build();
            if (requestAccess.saveIfStatus(failed, RequestStatus.PENDING)) {
                auditLogService.recordFailed(failed, ex.getMessage());
            }
            throw ex;
        }

        // Approve, reject or cancel may have landed while the plan was computed; the plan is
        // merged into whatever is stored now and only while the request is still pending.
        Request latest = latest(request);
        boolean alreadyQueued = latest.getQueuedAt() != null;
        boolean autoRun = !alreadyQueued && !options.verificationRequired() && !plan.requiresApproval();
        long planned = clock.millis();
        Request stored = latest.toBuilder()
                .metadata(latest.metadataWith(Request.META_DELETION_PLAN, RequestDocuments.toDocument(plan)))
                .queuedAt(autoRun ? Long.valueOf(planned) : latest.getQueuedAt())
                .updatedAt(planned)
                .build();
        if (!requestAccess.saveIfStatus(stored, RequestStatus.PENDING)) {
            Request current = latest(request);
            log.info("Deletion request {} became {} while its plan was generated; plan discarded",
                    current.getRequestId(), current.getStatus().value());
            return current;
        }
        auditLogService.recordPlanGenerated(stored, plan);

        if (autoRun) {
            log.info("Deletion request {} needs no approval; starting processing", stored.getRequestId());
            dispatcher.dispatch(stored.getRequestId());
        } else {
            log.info("Deletion request {} awaits approval: warnings={}", stored.getRequestId(), plan.warnings());
        }
        return stored;
    }

    /**
     * Builds a plan without creating a request.
     */
    public DeletionPlan previewPlan(String subjectType, String subjectValue) {
        if (subjectType == null || subjectType.isBlank()) {
            throw new IllegalArgumentException("subjectType must be non-blank");
        }
        if (subjectValue == null || subjectValue.isBlank()) {
            throw new IllegalArgumentException("subjectValue must be non-blank");
        }
        return planner.generatePlan(subjectType, subjectValue);
    }

    public Request approve(ApproveDeletionServiceRequest command) {
        Request request = lifecycle.load(RequestKind.DELETE, command.requestId());
        long now = clock.millis();
        Request approved = lifecycle.transitionFromPending(request, "approve", builder -> builder
                .assignedTo(command.approver())
                .queuedAt(now));

        log.info("Deletion request {} approved by {}", approved.getRequestId(), command.approver());
        auditLogService.recordApproved(approved, command.approver());
        dispatcher.dispatch(approved.getRequestId());
        return approved;
    }

    public Request reject(RejectDeletionServiceRequest command) {
        Request request = lifecycle.load(RequestKind.DELETE, command.requestId());
        Request rejected = lifecycle.transitionFromPending(request, "reject", builder -> builder
                .status(RequestStatus.FAILED)
                .assignedTo(command.approver())
                .reason(command.reason())
                .queuedAt(null));

        log.info("Deletion request {} rejected by {}: {}",
                rejected.getRequestId(), command.approver(), command.reason());
        auditLogService.recordRejected(rejected, command.approver(), command.reason());
        return rejected;
    }

    public Request cancel(long requestId, String cancelledBy) {
        return lifecycle.cancel(new CancelRequestServiceRequest(RequestKind.DELETE, requestId, cancelledBy));
    }

    public DeletionStatus getStatus(long requestId) {
        Request request = lifecycle.load(RequestKind.DELETE, requestId);
        List<RequestItem> items = lifecycle.items(requestId);
        long totalDeletedRows = items.stream()
                .filter(item -> item.getStatus() == RequestStatus.COMPLETED)
                .mapToLong(item -> item.getAffectedRows() == null ? 0L : item.getAffectedRows())
                .sum();
        return new DeletionStatus(request, items, RequestDocuments.deletionPlan(request),
                RequestProgress.of(items), totalDeletedRows);
    }

    private Request latest(Request request) {
        return requestAccess.findById(request.getRequestId()).orElse(request);
    }
}

package com.example.dsr.service;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.access.RequestItemAccess;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.requests.CancelRequestServiceRequest;
import java.time.Clock;
import java.util.List;
import java.util.function.UnaryOperator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Lookups and caller-driven transitions shared by both request kinds. Every transition out of
 * {@code pending} is a compare-and-set on the stored status, so two callers racing on the same
 * request cannot both succeed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RequestLifecycle {

    private final RequestAccess requestAccess;
    private final RequestItemAccess requestItemAccess;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public Request load(RequestKind kind, long requestId) {
        return requestAccess.findById(requestId)
                .filter(request -> request.getKind() == kind)
                .orElseThrow(() -> DsrException.requestNotFound(kind, requestId));
    }

    public List<RequestItem> items(long requestId) {
        return requestItemAccess.findAllByRequestId(requestId);
    }

    /**
     * Applies {@code change} to a pending request and stores it only if it is still pending.
     *
     * @param action verb used in the error message, e.g. "approve"
     * @throws DsrException when the request is not pending, or stops being pending before the write
     */
    public Request transitionFromPending(Request current,
                                         String action,
                                         UnaryOperator<Request.RequestBuilder> change) {
        if (!current.hasStatus(RequestStatus.PENDING)) {
            throw DsrException.invalidTransition(action, current.getStatus());
        }
        Request next = change.apply(current.toBuilder().updatedAt(clock.millis())).build();
        if (!requestAccess.saveIfStatus(next, RequestStatus.PENDING)) {
            RequestStatus now = requestAccess.findById(current.getRequestId())
                    .map(Request::getStatus)
                    .orElse(current.getStatus());
            throw DsrException.invalidTransition(action, now);
        }
        return next;
    }

    public Request cancel(CancelRequestServiceRequest command) {
        Request request = load(command.kind(), command.requestId());
        Request cancelled = transitionFromPending(request, "cancel", builder -> builder
                .status(RequestStatus.CANCELLED)
                .queuedAt(null));

        int itemsCancelled = 0;
        for (RequestItem item : requestItemAccess.findAllByRequestId(command.requestId())) {
            if (item.getStatus() == RequestStatus.PENDING) {
                requestItemAccess.save(item.toBuilder()
                        .status(RequestStatus.CANCELLED)
                        .updatedAt(clock.millis())
                        .build());
                itemsCancelled++;
            }
        }

        log.info("{} request {} cancelled by {}", cancelled.getKind().value(), cancelled.getRequestId(),
                command.cancelledBy());
        auditLogService.recordCancelled(cancelled, command.cancelledBy(), itemsCancelled);
        return cancelled;
    }
}

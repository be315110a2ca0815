package com.example.dsr.http;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.access.RequestQuery;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.service.AuditLogService;
import com.example.dsr.service.DsrException;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views across both request kinds: filtered listing and the per-request audit trail.
 */
@RestController
public class RequestQueryController {

    private final RequestAccess requestAccess;
    private final AuditLogService auditLogService;

    public RequestQueryController(RequestAccess requestAccess, AuditLogService auditLogService) {
        this.requestAccess = requestAccess;
        this.auditLogService = auditLogService;
    }

    @GetMapping("/requests")
    public ResponseEntity<List<RequestResponse>> listRequests(
            @RequestParam(value = "kind", required = false) String kind,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "subject_type", required = false) String subjectType,
            @RequestParam(value = "requested_by", required = false) String requestedBy,
            @RequestParam(value = "limit", required = false) Integer limit
    ) {
        RequestQuery query = new RequestQuery(
                kind == null ? null : RequestKind.fromValue(kind),
                status == null ? null : RequestStatus.fromValue(status),
                subjectType,
                requestedBy,
                limit
        );
        List<RequestResponse> response = requestAccess.find(query).stream()
                .map(RequestResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/requests/{requestId}/audit-events")
    public ResponseEntity<List<AuditEventResponse>> getAuditEvents(@PathVariable long requestId) {
        if (requestAccess.findById(requestId).isEmpty()) {
            throw DsrException.requestNotFound(requestId);
        }
        List<AuditEventResponse> response = auditLogService.trail(requestId).stream()
                .map(this::map)
                .toList();
        return ResponseEntity.ok(response);
    }

    private AuditEventResponse map(AuditEvent event) {
        return new AuditEventResponse(
                event.getRequestId(),
                event.getTsUlid(),
                event.getEventType(),
                event.getActor(),
                event.getCorrelationId(),
                event.getTableRef(),
                event.getTimestamp(),
                event.getPrevHash(),
                event.getHash(),
                event.getDetails()
        );
    }
}

package com.example.dsr.service;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.requests.CancelRequestServiceRequest;
import com.example.dsr.requests.SubmitExportServiceRequest;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Right-of-access requests: collects everything held about a subject into one export.
 * Submission only records the request; discovery and extraction run in the background.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExportRequestService {

    private final RequestAccess requestAccess;
    private final RequestLifecycle lifecycle;
    private final RequestDispatcher dispatcher;
    private final ExportCompiler exportCompiler;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public Request submit(SubmitExportServiceRequest command) {
        Objects.requireNonNull(command, "command");

        long now = clock.millis();
        Request.RequestBuilder builder = Request.builder()
                .requestId(requestAccess.nextRequestId())
                .kind(RequestKind.EXPORT)
                .subjectType(command.subjectType())
                .subjectValue(command.subjectValue())
                .status(RequestStatus.PENDING)
                .requestedBy(command.requestedBy())
                .reason(command.reason())
                .correlationId(command.correlationId())
                .requestedAt(now)
                .updatedAt(now)
                .queuedAt(now);
        if (command.notes() != null && !command.notes().isEmpty()) {
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(Request.META_NOTES, command.notes());
            builder.metadata(metadata);
        }

        Request request = requestAccess.save(builder.build());
        log.info("Export request {} created for subject type {} by {}",
                request.getRequestId(), request.getSubjectType(), request.getRequestedBy());
        auditLogService.recordSubmitted(request);

        dispatcher.dispatch(request.getRequestId());
        return request;
    }

    public ExportStatus getStatus(long requestId) {
        Request request = lifecycle.load(RequestKind.EXPORT, requestId);
        List<RequestItem> items = lifecycle.items(requestId);
        return new ExportStatus(request, items, RequestProgress.of(items));
    }

    public Request cancel(long requestId, String cancelledBy) {
        return lifecycle.cancel(new CancelRequestServiceRequest(RequestKind.EXPORT, requestId, cancelledBy));
    }

    /**
     * Renders a completed export in the requested format.
     *
     * @throws DsrException if the export has not completed or the format is unknown
     */
    public ExportDocument download(long requestId, String format) {
        ExportFormat exportFormat = ExportFormat.fromValue(format);
        Request request = lifecycle.load(RequestKind.EXPORT, requestId);
        if (!request.hasStatus(RequestStatus.COMPLETED)) {
            throw DsrException.invalidTransition("download", request.getStatus());
        }
        return exportCompiler.render(request, lifecycle.items(requestId), exportFormat, clock.millis());
    }
}

package com.example.dsr.http;

import com.example.dsr.models.Request;
import com.example.dsr.requests.CancelRequestHttpRequest;
import com.example.dsr.requests.CreateExportHttpRequest;
import com.example.dsr.requests.SubmitExportServiceRequest;
import com.example.dsr.service.ExportDocument;
import com.example.dsr.service.ExportRequestService;
import jakarta.validation.Valid;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for data export requests. Submission answers 202 as soon as the request is
 * stored; callers poll the status endpoint and download the export once it has completed.
 */
@RestController
public class ExportRequestController {

    private final ExportRequestService exportRequestService;

    public ExportRequestController(ExportRequestService exportRequestService) {
        this.exportRequestService = exportRequestService;
    }

    @PostMapping("/export-requests")
    public ResponseEntity<RequestResponse> createExportRequest(
            @Valid @RequestBody CreateExportHttpRequest request
    ) {
        Request created = exportRequestService.submit(new SubmitExportServiceRequest(
                request.subjectType(),
                request.subjectValue(),
                request.requestedBy(),
                request.reason(),
                request.notes(),
                CorrelationIds.current()
        ));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RequestResponse.from(created));
    }

    @GetMapping("/export-requests/{requestId}")
    public ResponseEntity<ExportStatusResponse> getExportStatus(@PathVariable long requestId) {
        return ResponseEntity.ok(ExportStatusResponse.from(exportRequestService.getStatus(requestId)));
    }

    @GetMapping("/export-requests/{requestId}/download")
    public ResponseEntity<String> downloadExport(
            @PathVariable long requestId,
            @RequestParam(value = "format", defaultValue = "json") String format
    ) {
        ExportDocument document = exportRequestService.download(requestId, format);
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(document.format().mediaType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(document.fileName()).build().toString())
                .body(document.content());
    }

    @PostMapping("/export-requests/{requestId}/cancel")
    public ResponseEntity<RequestResponse> cancelExportRequest(
            @PathVariable long requestId,
            @RequestBody(required = false) CancelRequestHttpRequest request
    ) {
        String cancelledBy = request != null ? request.cancelledBy() : null;
        return ResponseEntity.ok(RequestResponse.from(exportRequestService.cancel(requestId, cancelledBy)));
    }
}

package com.example.dsr.http;

import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.Request;
import com.example.dsr.requests.ApproveDeletionHttpRequest;
import com.example.dsr.requests.ApproveDeletionServiceRequest;
import com.example.dsr.requests.CancelRequestHttpRequest;
import com.example.dsr.requests.CreateDeletionHttpRequest;
import com.example.dsr.requests.DeletionPlanHttpRequest;
import com.example.dsr.requests.RejectDeletionHttpRequest;
import com.example.dsr.requests.RejectDeletionServiceRequest;
import com.example.dsr.requests.SubmitDeletionServiceRequest;
import com.example.dsr.service.DeletionRequestService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for erasure requests: submission with a synchronously computed plan, plan
 * previews, the approval gate and status polling.
 */
@RestController
public class DeletionRequestController {

    private final DeletionRequestService deletionRequestService;

    public DeletionRequestController(DeletionRequestService deletionRequestService) {
        this.deletionRequestService = deletionRequestService;
    }

    @PostMapping("/deletion-requests")
    public ResponseEntity<RequestResponse> createDeletionRequest(
            @Valid @RequestBody CreateDeletionHttpRequest request
    ) {
        Request created = deletionRequestService.submit(new SubmitDeletionServiceRequest(
                request.subjectType(),
                request.subjectValue(),
                request.requestedBy(),
                request.reason(),
                request.options(),
                request.notes(),
                CorrelationIds.current()
        ));
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(RequestResponse.from(created));
    }

    @PostMapping("/deletion-plans")
    public ResponseEntity<DeletionPlan> generateDeletionPlan(@Valid @RequestBody DeletionPlanHttpRequest request) {
        return ResponseEntity.ok(deletionRequestService.previewPlan(request.subjectType(), request.subjectValue()));
    }

    @PostMapping("/deletion-requests/{requestId}/approve")
    public ResponseEntity<RequestResponse> approveDeletionRequest(
            @PathVariable long requestId,
            @Valid @RequestBody ApproveDeletionHttpRequest request
    ) {
        Request approved = deletionRequestService.approve(
                new ApproveDeletionServiceRequest(requestId, request.approver()));
        return ResponseEntity.ok(RequestResponse.from(approved));
    }

    @PostMapping("/deletion-requests/{requestId}/reject")
    public ResponseEntity<RequestResponse> rejectDeletionRequest(
            @PathVariable long requestId,
            @Valid @RequestBody RejectDeletionHttpRequest request
    ) {
        Request rejected = deletionRequestService.reject(
                new RejectDeletionServiceRequest(requestId, request.approver(), request.reason()));
        return ResponseEntity.ok(RequestResponse.from(rejected));
    }

    @PostMapping("/deletion-requests/{requestId}/cancel")
    public ResponseEntity<RequestResponse> cancelDeletionRequest(
            @PathVariable long requestId,
            @RequestBody(required = false) CancelRequestHttpRequest request
    ) {
        String cancelledBy = request != null ? request.cancelledBy() : null;
        return ResponseEntity.ok(RequestResponse.from(deletionRequestService.cancel(requestId, cancelledBy)));
    }

    @GetMapping("/deletion-requests/{requestId}")
    public ResponseEntity<DeletionStatusResponse> getDeletionStatus(@PathVariable long requestId) {
        return ResponseEntity.ok(DeletionStatusResponse.from(deletionRequestService.getStatus(requestId)));
    }
}

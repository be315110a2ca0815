package com.example.dsr.service;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Hands requests to the processing pool without making the caller wait. Nothing raised by
 * processing reaches the caller; outcomes are observed through the request's status.
 *
 * <p>A request that cannot be handed over stays {@code pending} with its {@code queued_at} set,
 * which is what {@link QueuedRequestReconciler} picks up.
 */
@Component
@Slf4j
public class RequestDispatcher {

    static final String MDC_KEY = "dsrRequestId";

    private final TaskExecutor executor;
    private final RequestProcessor processor;

    public RequestDispatcher(@Qualifier("requestProcessingExecutor") TaskExecutor executor,
                             RequestProcessor processor) {
        this.executor = executor;
        this.processor = processor;
    }

    public void dispatch(long requestId) {
        try {
            executor.execute(() -> run(requestId));
            log.debug("Dispatched request {} for processing", requestId);
        } catch (TaskRejectedException ex) {
            log.warn("Processing pool rejected request {}; leaving it for the reconciler: {}",
                    requestId, ex.getMessage());
        }
    }

    private void run(long requestId) {
        MDC.put(MDC_KEY, String.valueOf(requestId));
        try {
            processor.process(requestId);
        } catch (RuntimeException ex) {
            log.error("Background processing of request {} failed: {}", requestId, ex.getMessage(), ex);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}

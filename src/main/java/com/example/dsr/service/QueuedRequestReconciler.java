package com.example.dsr.service;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.config.ReconcilerProperties;
import com.example.dsr.models.Request;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Scheduled job that re-dispatches requests which were scheduled for processing but never
 * claimed, for example because the service stopped between accepting a request and running it.
 * Dispatching is safe to repeat since processing claims a request at most once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "dsr.reconciler.enabled", havingValue = "true")
public class QueuedRequestReconciler {

    private static final long MILLIS_PER_MINUTE = 60_000L;

    private final Clock clock;
    private final ReconcilerProperties properties;
    private final RequestAccess requestAccess;
    private final RequestDispatcher dispatcher;

    @Scheduled(cron = "${dsr.reconciler.schedule:0 */5 * * * *}")
    public void redispatchStaleRequests() {
        long startTime = clock.millis();
        long cutoffTimestamp = startTime - (properties.getGraceMinutes() * MILLIS_PER_MINUTE);
        log.info("Starting queued request reconciliation (grace period: {} minutes, cutoff: {})",
                properties.getGraceMinutes(), cutoffTimestamp);

        List<Request> stale;
        try {
            stale = requestAccess.findQueuedBefore(cutoffTimestamp);
        } catch (RuntimeException ex) {
            log.error("Failed to look up queued requests: {}", ex.getMessage(), ex);
            return;
        }

        for (Request request : stale) {
            log.warn("Request {} queued at {} was never claimed; dispatching again",
                    request.getRequestId(), request.getQueuedAt());
            dispatcher.dispatch(request.getRequestId());
        }

        long duration = clock.millis() - startTime;
        log.info("Completed queued request reconciliation in {}ms: redispatched={}", duration, stale.size());
    }
}

package com.example.dsr.service;

import com.example.dsr.access.AuditEventAccess;
import com.example.dsr.access.RequestAccess;
import com.example.dsr.config.AuditTrailRetentionProperties;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.Request;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Purges whole audit trails of requests that finished long ago.
 *
 * <p>A trail is only ever removed as a unit, and only when its request is terminal (or no longer
 * stored) and every event in it predates the cutoff. Trails of pending or processing requests are
 * never touched, so the hash chain {@link AuditLogService} keeps appending to stays intact.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(value = "dsr.audit-retention.enabled", havingValue = "true")
public class AuditTrailRetentionJob {

    private static final long MILLIS_PER_DAY = 86400000L;

    private final Clock clock;
    private final AuditTrailRetentionProperties properties;
    private final RequestAccess requestAccess;
    private final AuditEventAccess auditEventAccess;

    @Scheduled(cron = "${dsr.audit-retention.schedule:0 0 3 * * *}")
    public void purgeExpiredTrails() {
        long startTime = clock.millis();
        long cutoff = startTime - (properties.getRetentionDays() * MILLIS_PER_DAY);
        log.info("Starting audit trail purge: trails of finished requests older than {} ({} days)",
                Instant.ofEpochMilli(cutoff), properties.getRetentionDays());

        Map<Long, List<AuditEvent>> candidates = auditEventAccess.findEventsOlderThan(cutoff).stream()
                .collect(Collectors.groupingBy(AuditEvent::getRequestId, TreeMap::new, Collectors.toList()));

        int purgedTrails = 0;
        int deletedEvents = 0;
        int retainedActive = 0;
        int retainedRecent = 0;
        int failedTrails = 0;
        for (Long requestId : candidates.keySet()) {
            Optional<Request> request = requestAccess.findById(requestId);
            if (request.isPresent() && !request.get().getStatus().terminal()) {
                retainedActive++;
                continue;
            }
            List<AuditEvent> trail = auditEventAccess.findAllByRequestId(requestId);
            if (trail.stream().anyMatch(event -> event.getTimestamp() >= cutoff)) {
                retainedRecent++;
                continue;
            }
            int deleted = purgeTrail(requestId, trail);
            deletedEvents += deleted;
            if (deleted == trail.size()) {
                purgedTrails++;
            } else {
                failedTrails++;
            }
        }

        long duration = clock.millis() - startTime;
        log.info("Completed audit trail purge in {}ms: candidates={}, purged={}, events={}, "
                        + "retainedActive={}, retainedRecent={}, failed={}",
                duration, candidates.size(), purgedTrails, deletedEvents, retainedActive, retainedRecent,
                failedTrails);
    }

    /**
     * Deletes newest first so that an interrupted purge leaves a verifiable prefix of the chain;
     * the next run picks the rest up.
     */
    private int purgeTrail(long requestId, List<AuditEvent> trail) {
        int deleted = 0;
        for (int i = trail.size() - 1; i >= 0; i--) {
            AuditEvent event = trail.get(i);
            try {
                auditEventAccess.delete(event);
                deleted++;
            } catch (RuntimeException ex) {
                log.warn("Failed to delete audit event {} of request {}; {} events left: {}",
                        event.getTsUlid(), requestId, i + 1, ex.getMessage());
                break;
            }
        }
        return deleted;
    }
}

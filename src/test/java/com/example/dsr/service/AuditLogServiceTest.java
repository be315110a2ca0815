package com.example.dsr.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dsr.access.AuditEventAccess;
import com.example.dsr.access.InMemoryAuditEventAccess;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

class AuditLogServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T12:34:56Z"), ZoneOffset.UTC);
    private static final long NOW = CLOCK.millis();

    private AuditEventAccess access;
    private AuditLogService auditLogService;

    @BeforeEach
    void setUp() {
        access = Mockito.mock(AuditEventAccess.class);
        auditLogService = new AuditLogService(access, CLOCK);
    }

    @Test
    @DisplayName("recordSubmitted starts the chain at the zero hash")
    void recordSubmittedGenesis() {
        when(access.findLatest(7L)).thenReturn(Optional.empty());

        auditLogService.recordSubmitted(request());

        AuditEvent event = captured();
        assertEquals(AuditEvent.EventType.REQUEST_SUBMITTED, event.getEventType());
        assertEquals(7L, event.getRequestId());
        assertEquals("jane", event.getActor());
        assertEquals("corr-7", event.getCorrelationId());
        assertEquals(NOW, event.getTimestamp());
        assertEquals(AuditLogService.generateTimestampUlid(NOW, 1), event.getTsUlid());
        assertEquals("0".repeat(64), event.getPrevHash());
        assertEquals("delete", event.getDetails().get("kind"));
        assertEquals("email", event.getDetails().get("subject_type"));
        assertNotNull(event.getHash());
    }

    @Test
    @DisplayName("later events link to the previous hash and advance the position")
    void chainsToLatest() {
        AuditEvent latest = sampleEvent(AuditLogService.generateTimestampUlid(NOW, 4));
        when(access.findLatest(7L)).thenReturn(Optional.of(latest));

        auditLogService.recordApproved(request(), "dpo");

        AuditEvent event = captured();
        assertEquals(AuditEvent.EventType.APPROVED, event.getEventType());
        assertEquals("dpo", event.getActor());
        assertEquals(latest.getHash(), event.getPrevHash());
        assertEquals(AuditLogService.generateTimestampUlid(NOW, 5), event.getTsUlid());
        assertNull(event.getDetails());
    }

    @Test
    @DisplayName("sort key never goes backwards when the clock does")
    void clockStepsBack() {
        when(access.findLatest(7L)).thenReturn(Optional.of(sampleEvent("9999999999999_000002")));

        auditLogService.recordProcessingStarted(request());

        assertEquals("9999999999999_000003", captured().getTsUlid());
    }

    @Test
    @DisplayName("item failures carry the table and the error")
    void recordItemFailed() {
        when(access.findLatest(7L)).thenReturn(Optional.empty());
        RequestItem item = RequestItem.builder()
                .requestId(7L)
                .sequence(1)
                .databaseName("shop")
                .schemaName("public")
                .tableName("orders")
                .columns(List.of("user_id"))
                .status(RequestStatus.FAILED)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();

        auditLogService.recordItemFailed(request(), item, "boom");

        AuditEvent event = captured();
        assertEquals(AuditEvent.EventType.ITEM_FAILED, event.getEventType());
        assertEquals(AuditLogService.SYSTEM_ACTOR, event.getActor());
        assertEquals("shop.public.orders", event.getTableRef());
        assertEquals("boom", event.getDetails().get("error"));
    }

    @Test
    @DisplayName("a malformed sort key on the latest event is reported")
    void malformedSortKey() {
        when(access.findLatest(7L)).thenReturn(Optional.of(sampleEvent("0_MOCK")));

        assertThrows(IllegalStateException.class, () -> auditLogService.recordCancelled(request(), "jane", 0));
    }

    @Test
    @DisplayName("events recorded in the same millisecond read back in chain order")
    void sameMillisecondOrdering() {
        InMemoryAuditEventAccess memory = new InMemoryAuditEventAccess();
        AuditLogService service = new AuditLogService(memory, CLOCK);
        Request request = request();

        service.recordSubmitted(request);
        service.recordApproved(request, "dpo");
        service.recordProcessingStarted(request);
        service.recordFailed(request, "boom");

        List<AuditEvent> trail = service.trail(7L);
        assertEquals(List.of(
                AuditEvent.EventType.REQUEST_SUBMITTED,
                AuditEvent.EventType.APPROVED,
                AuditEvent.EventType.PROCESSING_STARTED,
                AuditEvent.EventType.REQUEST_FAILED), trail.stream().map(AuditEvent::getEventType).toList());
        for (int i = 1; i < trail.size(); i++) {
            assertEquals(trail.get(i - 1).getHash(), trail.get(i).getPrevHash());
        }
    }

    @Test
    @DisplayName("sort keys are zero padded")
    void timestampUlidFormat() {
        assertEquals("1727784000000_000001", AuditLogService.generateTimestampUlid(1727784000000L, 1));
        assertEquals("0000000001000_000012", AuditLogService.generateTimestampUlid(1000L, 12));
    }

    private AuditEvent captured() {
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(access).put(captor.capture());
        return captor.getValue();
    }

    private static Request request() {
        return Request.builder()
                .requestId(7L)
                .kind(RequestKind.DELETE)
                .subjectType("email")
                .subjectValue("jane@example.com")
                .status(RequestStatus.PENDING)
                .requestedBy("jane")
                .correlationId("corr-7")
                .requestedAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static AuditEvent sampleEvent(String tsUlid) {
        return AuditEvent.builder()
                .requestId(7L)
                .tsUlid(tsUlid)
                .eventType(AuditEvent.EventType.REQUEST_SUBMITTED)
                .actor("jane")
                .timestamp(NOW)
                .prevHash("0".repeat(64))
                .build();
    }
}

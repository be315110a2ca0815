package com.example.dsr.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.dsr.access.InMemoryAuditEventAccess;
import com.example.dsr.access.InMemoryMetadataCatalog;
import com.example.dsr.access.InMemoryRequestAccess;
import com.example.dsr.access.InMemoryRequestItemAccess;
import com.example.dsr.config.PlanningProperties;
import com.example.dsr.connector.WarehouseConnector;
import com.example.dsr.connector.WarehouseException;
import com.example.dsr.discovery.RelevanceScorer;
import com.example.dsr.discovery.SubjectColumnMatcher;
import com.example.dsr.discovery.TableDiscoveryService;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.models.TableRef;
import com.example.dsr.requests.SubmitExportServiceRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;

class ExportRequestServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneOffset.UTC);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TableRef CUSTOMERS = new TableRef("wh", "crm", "customers");
    private static final TableRef EVENTS = new TableRef("wh", "public", "events");
    private static final String SUBJECT = "jane@example.com";

    private InMemoryRequestAccess requestAccess;
    private InMemoryRequestItemAccess itemAccess;
    private InMemoryAuditEventAccess auditAccess;
    private WarehouseConnector warehouse;
    private TableDiscoveryService discovery;
    private AuditLogService auditLogService;
    private ExportRequestService service;

    @BeforeEach
    void setUp() {
        requestAccess = new InMemoryRequestAccess();
        itemAccess = new InMemoryRequestItemAccess();
        auditAccess = new InMemoryAuditEventAccess();
        warehouse = mock(WarehouseConnector.class);
        InMemoryMetadataCatalog catalog = new InMemoryMetadataCatalog()
                .table(EVENTS, "event_id", "user_email")
                .table(CUSTOMERS, "email", "name");
        discovery = new TableDiscoveryService(catalog, warehouse, new SubjectColumnMatcher(),
                new RelevanceScorer(), new PlanningProperties());
        auditLogService = new AuditLogService(auditAccess, CLOCK);
        service = serviceWith(new SyncTaskExecutor());

        when(warehouse.extractRows(eq(CUSTOMERS), anyList(), eq(SUBJECT)))
                .thenReturn(List.of(row("email", SUBJECT, "name", "Jane, Doe")));
        when(warehouse.extractRows(eq(EVENTS), anyList(), eq(SUBJECT)))
                .thenReturn(List.of(row("event_id", "e1", "user_email", SUBJECT),
                        row("event_id", "e2", "user_email", SUBJECT)));
    }

    @Test
    @DisplayName("export extracts every relevant table and summarizes the result")
    void exportCompletes() {
        Request submitted = service.submit(command());
        ExportStatus status = service.getStatus(submitted.getRequestId());

        assertEquals(RequestStatus.COMPLETED, status.request().getStatus());
        assertEquals(2, status.items().size());
        assertEquals("customers", status.items().get(0).getTableName());
        assertEquals(1L, status.items().get(0).getAffectedRows());
        assertEquals("events", status.items().get(1).getTableName());
        assertEquals(2L, status.items().get(1).getAffectedRows());
        assertEquals(100, status.progress().percentage());

        Map<String, Object> summary = resultSummary(status.request());
        assertEquals(3L, summary.get("total_records"));
        assertEquals(List.of("wh.crm.customers", "wh.public.events"), summary.get("exported_tables"));
        assertEquals("json", summary.get("export_format"));
        assertEquals("2024-10-01T12:00:00Z", summary.get("completed_at"));
    }

    @Test
    @DisplayName("a failing table is reported while the export still completes")
    void failingTable() {
        when(warehouse.extractRows(eq(EVENTS), anyList(), eq(SUBJECT)))
                .thenThrow(WarehouseException.tableUnavailable(EVENTS));

        Request submitted = service.submit(command());
        ExportStatus status = service.getStatus(submitted.getRequestId());

        assertEquals(RequestStatus.COMPLETED, status.request().getStatus());
        assertEquals(1, status.progress().failedItems());
        assertEquals(RequestStatus.FAILED, status.items().get(1).getStatus());

        Map<String, Object> summary = resultSummary(status.request());
        assertEquals(1L, summary.get("total_records"));
        assertEquals(List.of("wh.crm.customers"), summary.get("exported_tables"));
    }

    @Test
    @DisplayName("completed exports download as JSON and CSV")
    void download() throws Exception {
        Request submitted = service.submit(command());

        ExportDocument json = service.download(submitted.getRequestId(), "json");
        assertEquals("export-" + submitted.getRequestId() + ".json", json.fileName());
        JsonNode document = MAPPER.readTree(json.content());
        assertEquals(3, document.get("export_metadata").get("total_records").asInt());
        assertEquals(2, document.get("export_metadata").get("tables").asInt());
        assertEquals("Jane, Doe", document.get("data").get("wh.crm.customers").get(0).get("name").asText());

        ExportDocument csv = service.download(submitted.getRequestId(), "CSV");
        assertEquals(ExportFormat.CSV, csv.format());
        assertEquals(String.join("\n",
                "# Table: wh.crm.customers",
                "email,name",
                SUBJECT + ",\"Jane, Doe\"",
                "",
                "# Table: wh.public.events",
                "event_id,user_email",
                "e1," + SUBJECT,
                "e2," + SUBJECT,
                ""), csv.content());
    }

    @Test
    @DisplayName("unknown formats are rejected")
    void unsupportedFormat() {
        Request submitted = service.submit(command());

        DsrException ex = assertThrows(DsrException.class, () -> service.download(submitted.getRequestId(), "xml"));
        assertEquals(DsrException.Code.UNSUPPORTED_EXPORT_FORMAT, ex.getCode());
    }

    @Test
    @DisplayName("unfinished exports cannot be downloaded and can be cancelled")
    void pendingExport() {
        TaskExecutor idle = task -> { };
        ExportRequestService queued = serviceWith(idle);

        Request submitted = queued.submit(command());
        assertEquals(RequestStatus.PENDING, submitted.getStatus());
        assertEquals(CLOCK.millis(), submitted.getQueuedAt());

        DsrException ex = assertThrows(DsrException.class, () -> queued.download(submitted.getRequestId(), "json"));
        assertEquals("Cannot download request with status: pending", ex.getMessage());

        Request cancelled = queued.cancel(submitted.getRequestId(), "jane");
        assertEquals(RequestStatus.CANCELLED, cancelled.getStatus());
        assertNull(cancelled.getQueuedAt());
        assertTrue(queued.getStatus(submitted.getRequestId()).items().isEmpty());
    }

    @Test
    @DisplayName("notes are kept in the request metadata")
    void notesKept() {
        Request submitted = service.submit(new SubmitExportServiceRequest(
                "email", SUBJECT, "jane", null, Map.of("ticket", "PRIV-7"), null));

        assertEquals(Map.of("ticket", "PRIV-7"), submitted.getMetadata().get(Request.META_NOTES));
    }

    @Test
    @DisplayName("deletion ids are not found as exports")
    void notFound() {
        DsrException ex = assertThrows(DsrException.class, () -> service.getStatus(7));
        assertEquals("Export request 7 not found", ex.getMessage());
    }

    private ExportRequestService serviceWith(TaskExecutor executor) {
        RequestProcessor processor = new RequestProcessor(requestAccess, itemAccess, discovery, warehouse,
                new ExportCompiler(), auditLogService, CLOCK);
        RequestDispatcher dispatcher = new RequestDispatcher(executor, processor);
        RequestLifecycle lifecycle = new RequestLifecycle(requestAccess, itemAccess, auditLogService, CLOCK);
        return new ExportRequestService(requestAccess, lifecycle, dispatcher, new ExportCompiler(),
                auditLogService, CLOCK);
    }

    private static SubmitExportServiceRequest command() {
        return new SubmitExportServiceRequest("email", SUBJECT, "jane", "GDPR Art. 15", null, "corr-1");
    }

    private static Map<String, Object> resultSummary(Request request) {
        Map<String, Object> summary = new LinkedHashMap<>();
        ((Map<?, ?>) request.getMetadata().get(Request.META_RESULT_SUMMARY))
                .forEach((key, value) -> summary.put(String.valueOf(key), value));
        return summary;
    }

    private static Map<String, Object> row(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(k1, v1);
        row.put(k2, v2);
        return row;
    }
}

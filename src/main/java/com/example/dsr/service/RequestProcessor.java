package com.example.dsr.service;

import com.example.dsr.access.RequestAccess;
import com.example.dsr.access.RequestItemAccess;
import com.example.dsr.connector.WarehouseConnector;
import com.example.dsr.discovery.DiscoveredTable;
import com.example.dsr.discovery.TableDiscoveryService;
import com.example.dsr.models.DeletionOptions;
import com.example.dsr.models.DeletionPlan;
import com.example.dsr.models.PlannedTable;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.models.TableRef;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs a request to its terminal state.
 *
 * <p>A request is first claimed with a conditional write from {@code pending} to
 * {@code processing}; whoever loses the claim does nothing, so invoking {@link #process} twice
 * for one request runs it at most once. Items are created together and executed one after the
 * other in plan order. A connector failure only fails its own item. Any other error fails the
 * whole request and leaves finished items as they are.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RequestProcessor {

    private final RequestAccess requestAccess;
    private final RequestItemAccess requestItemAccess;
    private final TableDiscoveryService discoveryService;
    private final WarehouseConnector warehouse;
    private final ExportCompiler exportCompiler;
    private final AuditLogService auditLogService;
    private final Clock clock;

    public void process(long requestId) {
        Optional<Request> found = requestAccess.findById(requestId);
        if (found.isEmpty()) {
            log.warn("Request {} not found; nothing to process", requestId);
            return;
        }
        Request request = found.get();
        if (!request.hasStatus(RequestStatus.PENDING)) {
            log.info("Request {} is {}; skipping processing", requestId, request.getStatus().value());
            return;
        }

        Request claimed = request.toBuilder()
                .status(RequestStatus.PROCESSING)
                .queuedAt(null)
                .updatedAt(clock.millis())
                .build();
        if (!requestAccess.saveIfStatus(claimed, RequestStatus.PENDING)) {
            log.info("Request {} was claimed or changed concurrently; skipping processing", requestId);
            return;
        }

        log.info("Processing {} request {} for subject type {}",
                claimed.getKind().value(), requestId, claimed.getSubjectType());
        try {
            auditLogService.recordProcessingStarted(claimed);
            if (claimed.getKind() == RequestKind.EXPORT) {
                runExport(claimed);
            } else {
                runDeletion(claimed);
            }
        } catch (RuntimeException ex) {
            log.error("Processing of request {} failed: {}", requestId, ex.getMessage(), ex);
            markFailed(requestId, claimed, ex);
        }
    }

    private void runExport(Request request) {
        List<DiscoveredTable> tables = discoveryService.discoverForExport(request.getSubjectType());

        List<RequestItem> pending = new ArrayList<>(tables.size());
        Set<String> seen = new HashSet<>();
        long now = clock.millis();
        for (DiscoveredTable table : tables) {
            if (seen.add(table.ref().normalizedKey())) {
                pending.add(newItem(request, pending.size() + 1, table.ref(), table.columnNames(), null, null, now));
            }
        }

        request = startItems(request, pending);
        List<RequestItem> finished = new ArrayList<>(pending.size());
        for (RequestItem item : pending) {
            finished.add(processExportItem(request, item));
            request = recordProgress(request, finished);
        }

        long completedAt = clock.millis();
        Map<String, Object> summary = exportCompiler.summarize(finished, completedAt);
        complete(request, summary, completedAt);
    }

    private void runDeletion(Request request) {
        DeletionPlan plan = RequestDocuments.deletionPlan(request);
        if (plan == null) {
            throw new IllegalStateException("Deletion request " + request.getRequestId() + " has no stored plan");
        }
        DeletionOptions options = RequestDocuments.options(request);

        List<PlannedTable> ordered = plan.tablesToProcess().stream()
                .sorted(Comparator.comparingInt(PlannedTable::deletionOrder))
                .toList();
        List<RequestItem> pending = new ArrayList<>(ordered.size());
        Set<String> seen = new HashSet<>();
        long now = clock.millis();
        for (PlannedTable table : ordered) {
            if (seen.add(table.ref().normalizedKey())) {
                pending.add(newItem(request, pending.size() + 1, table.ref(), table.columns(),
                        table.estimatedRows(), table.deletionOrder(), now));
            }
        }

        request = startItems(request, pending);
        List<RequestItem> finished = new ArrayList<>(pending.size());
        long totalDeletedRows = 0;
        for (RequestItem item : pending) {
            RequestItem result = processDeleteItem(request, item, options);
            finished.add(result);
            if (result.getStatus() == RequestStatus.COMPLETED) {
                totalDeletedRows += result.getAffectedRows();
            }
            request = recordProgress(request, finished);
        }

        long completedAt = clock.millis();
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_deleted_rows", totalDeletedRows);
        summary.put("items_failed", RequestProgress.of(finished).failedItems());
        summary.put("completed_at", Instant.ofEpochMilli(completedAt).toString());
        complete(request, summary, completedAt);
    }

    RequestItem processExportItem(Request request, RequestItem item) {
        RequestItem running = startItem(item);
        List<Map<String, Object>> rows;
        try {
            rows = warehouse.extractRows(running.tableRef(), running.getColumns(), request.getSubjectValue());
        } catch (RuntimeException ex) {
            return failItem(request, running, ex);
        }

        long now = clock.millis();
        Map<String, Object> resultData = new LinkedHashMap<>();
        resultData.put("row_count", rows.size());
        resultData.put("columns", running.getColumns());
        resultData.put("extracted_at", Instant.ofEpochMilli(now).toString());
        resultData.put(ExportCompiler.ROWS, rows);
        return completeItem(request, running, rows.size(), resultData, now);
    }

    RequestItem processDeleteItem(Request request, RequestItem item, DeletionOptions options) {
        RequestItem running = startItem(item);
        long deletedRows;
        try {
            deletedRows = warehouse.deleteRows(
                    running.tableRef(), running.getColumns(), request.getSubjectValue(), options);
        } catch (RuntimeException ex) {
            return failItem(request, running, ex);
        }

        long now = clock.millis();
        Map<String, Object> resultData = new LinkedHashMap<>();
        resultData.put("deleted_rows", deletedRows);
        resultData.put("deletion_type", options.deletionType());
        return completeItem(request, running, deletedRows, resultData, now);
    }

    private RequestItem newItem(Request request,
                                int sequence,
                                TableRef table,
                                List<String> columns,
                                Long estimatedRows,
                                Integer deletionOrder,
                                long now) {
        return RequestItem.builder()
                .requestId(request.getRequestId())
                .sequence(sequence)
                .databaseName(table.databaseName())
                .schemaName(table.schemaName())
                .tableName(table.tableName())
                .columns(columns)
                .status(RequestStatus.PENDING)
                .affectedRows(estimatedRows)
                .deletionOrder(deletionOrder)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private Request startItems(Request request, List<RequestItem> items) {
        items.forEach(requestItemAccess::save);
        Request updated = request.toBuilder()
                .totalItems(items.size())
                .completedItems(0)
                .failedItems(0)
                .updatedAt(clock.millis())
                .build();
        log.info("Created {} items for request {}", items.size(), request.getRequestId());
        return requestAccess.save(updated);
    }

    private RequestItem startItem(RequestItem item) {
        return requestItemAccess.save(item.toBuilder()
                .status(RequestStatus.PROCESSING)
                .updatedAt(clock.millis())
                .build());
    }

    private RequestItem completeItem(Request request,
                                     RequestItem running,
                                     long affectedRows,
                                     Map<String, Object> resultData,
                                     long now) {
        RequestItem completed = requestItemAccess.save(running.toBuilder()
                .status(RequestStatus.COMPLETED)
                .affectedRows(affectedRows)
                .resultData(resultData)
                .processedAt(now)
                .updatedAt(now)
                .build());
        log.info("Item {} of request {} completed on {}: affected_rows={}",
                completed.getSequence(), request.getRequestId(), completed.tableRef(), affectedRows);
        auditLogService.recordItemCompleted(request, completed);
        return completed;
    }

    private RequestItem failItem(Request request, RequestItem running, RuntimeException cause) {
        log.error("Item {} of request {} failed on {}: {}",
                running.getSequence(), request.getRequestId(), running.tableRef(), cause.getMessage(), cause);
        long now = clock.millis();
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        RequestItem failed = requestItemAccess.save(running.toBuilder()
                .status(RequestStatus.FAILED)
                .affectedRows(0L)
                .errorMessage(message)
                .processedAt(now)
                .updatedAt(now)
                .build());
        auditLogService.recordItemFailed(request, failed, message);
        return failed;
    }

    private Request recordProgress(Request request, List<RequestItem> finished) {
        RequestProgress progress = RequestProgress.of(finished);
        return requestAccess.save(request.toBuilder()
                .completedItems(progress.completedItems())
                .failedItems(progress.failedItems())
                .updatedAt(clock.millis())
                .build());
    }

    private void complete(Request request, Map<String, Object> summary, long completedAt) {
        Request completed = requestAccess.save(request.toBuilder()
                .status(RequestStatus.COMPLETED)
                .completedAt(completedAt)
                .updatedAt(completedAt)
                .metadata(request.metadataWith(Request.META_RESULT_SUMMARY, summary))
                .build());
        log.info("{} request {} completed: items={}, failed_items={}",
                completed.getKind().value(), completed.getRequestId(),
                completed.getTotalItems(), completed.getFailedItems());
        auditLogService.recordCompleted(completed, summary);
    }

    private void markFailed(long requestId, Request claimed, RuntimeException cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        try {
            Request latest = requestAccess.findById(requestId).orElse(claimed);
            long now = clock.millis();
            Request failed = requestAccess.save(latest.toBuilder()
                    .status(RequestStatus.FAILED)
                    .updatedAt(now)
                    .metadata(latest.metadataWith(Request.META_FAILURE, message))
                    .build());
            auditLogService.recordFailed(failed, message);
        } catch (RuntimeException ex) {
            log.error("Unable to record failure of request {}; it remains {}: {}",
                    requestId, RequestStatus.PROCESSING.value(), ex.getMessage(), ex);
        }
    }
}

package com.example.dsr.service;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Assembles the rows extracted by completed export items into a single deliverable document and
 * the summary stored on the request.
 */
@Component
public class ExportCompiler {

    static final String ROWS = "rows";

    private final CsvMapper csvMapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    public Map<String, Object> summarize(List<RequestItem> items, long completedAt) {
        Map<String, List<Map<String, Object>>> data = collect(items);
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("total_records", totalRecords(data));
        summary.put("exported_tables", new ArrayList<>(data.keySet()));
        summary.put("export_file_size", RequestDocuments.serializedSize(jsonDocument(data, completedAt)));
        summary.put("export_format", ExportFormat.JSON.value());
        summary.put("completed_at", Instant.ofEpochMilli(completedAt).toString());
        return summary;
    }

    public ExportDocument render(Request request, List<RequestItem> items, ExportFormat format, long exportedAt) {
        Map<String, List<Map<String, Object>>> data = collect(items);
        String fileName = "export-" + request.getRequestId() + "." + format.extension();
        String content = switch (format) {
            case JSON -> RequestDocuments.toJson(jsonDocument(data, exportedAt));
            case CSV -> toCsv(data);
        };
        return new ExportDocument(fileName, format, content);
    }

    private Map<String, Object> jsonDocument(Map<String, List<Map<String, Object>>> data, long exportedAt) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("exported_at", Instant.ofEpochMilli(exportedAt).toString());
        metadata.put("format", ExportFormat.JSON.value());
        metadata.put("total_records", totalRecords(data));
        metadata.put("tables", data.size());

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("export_metadata", metadata);
        document.put("data", data);
        return document;
    }

    /**
     * One {@code # Table:} section per table with rows. The header is every key seen across the
     * table's rows in first-seen order; a row without a key leaves that cell empty.
     */
    String toCsv(Map<String, List<Map<String, Object>>> data) {
        List<String> sections = new ArrayList<>();
        data.forEach((table, rows) -> {
            if (!rows.isEmpty()) {
                sections.add("# Table: " + table + "\n" + tableCsv(rows));
            }
        });
        return String.join("\n", sections);
    }

    private String tableCsv(List<Map<String, Object>> rows) {
        Set<String> headers = new LinkedHashSet<>();
        rows.forEach(row -> headers.addAll(row.keySet()));

        CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
        headers.forEach(schema::addColumn);

        List<Map<String, String>> cells = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, String> line = new LinkedHashMap<>();
            for (String header : headers) {
                line.put(header, cellValue(row.get(header)));
            }
            cells.add(line);
        }
        try {
            return csvMapper.writer(schema.build()).writeValueAsString(cells);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize export document", e);
        }
    }

    private static String cellValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map || value instanceof Collection) {
            return RequestDocuments.toJson(value);
        }
        return String.valueOf(value);
    }

    private Map<String, List<Map<String, Object>>> collect(List<RequestItem> items) {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        for (RequestItem item : items) {
            if (item.getStatus() != RequestStatus.COMPLETED) {
                continue;
            }
            Object rows = item.getResultData() == null ? null : item.getResultData().get(ROWS);
            data.put(item.tableRef().qualifiedName(), RequestDocuments.rows(rows));
        }
        return data;
    }

    private static long totalRecords(Map<String, List<Map<String, Object>>> data) {
        return data.values().stream().mapToLong(List::size).sum();
    }
}

package com.example.dsr.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ExportCompilerTest {

    private static final long NOW = 1727784000000L;

    private final ExportCompiler compiler = new ExportCompiler();

    @Test
    @DisplayName("csv cells with separators, quotes or line breaks are quoted")
    void csvQuoting() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("id", 1L);
        first.put("name", "Doe, Jane");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("id", 2L);
        second.put("name", "say \"hi\"");
        Map<String, Object> third = new LinkedHashMap<>();
        third.put("id", 3L);
        third.put("name", "line\nbreak");
        Map<String, Object> fourth = new LinkedHashMap<>();
        fourth.put("id", 4L);
        fourth.put("name", "carriage\rreturn");
        fourth.put("score", 99.5);

        ExportDocument document = compiler.render(request(),
                List.of(item(1, "users", RequestStatus.COMPLETED, List.of(first, second, third, fourth))),
                ExportFormat.CSV, NOW);

        assertEquals("# Table: db.public.users\n"
                + "id,name,score\n"
                + "1,\"Doe, Jane\",\n"
                + "2,\"say \"\"hi\"\"\",\n"
                + "3,\"line\nbreak\",\n"
                + "4,\"carriage\rreturn\",99.5\n", document.content());
    }

    @Test
    @DisplayName("csv header covers keys that only later rows carry")
    void csvHeaderUnion() {
        Map<String, Object> later = new LinkedHashMap<>();
        later.put("id", "e2");
        later.put("channel", "email");
        later.put("note", null);

        ExportDocument document = compiler.render(request(),
                List.of(item(1, "events", RequestStatus.COMPLETED, List.of(row("id", "e1"), later))),
                ExportFormat.CSV, NOW);

        assertEquals("# Table: db.public.events\nid,channel,note\ne1,,\ne2,email,\n", document.content());
    }

    @Test
    @DisplayName("only completed items contribute to the summary")
    void summaryCountsCompletedItems() {
        List<RequestItem> items = List.of(
                item(1, "users", RequestStatus.COMPLETED, List.of(row("id", "42"))),
                item(2, "orders", RequestStatus.FAILED, null),
                item(3, "events", RequestStatus.COMPLETED, List.of(row("id", "e1"), row("id", "e2"))));

        Map<String, Object> summary = compiler.summarize(items, NOW);

        assertEquals(3L, summary.get("total_records"));
        assertEquals(List.of("db.public.users", "db.public.events"), summary.get("exported_tables"));
        assertEquals("json", summary.get("export_format"));
        assertEquals("2024-10-01T12:00:00Z", summary.get("completed_at"));
        assertTrue((Long) summary.get("export_file_size") > 0);
    }

    @Test
    @DisplayName("tables without rows are left out of the csv")
    void csvSkipsEmptyTables() {
        List<RequestItem> items = List.of(
                item(1, "users", RequestStatus.COMPLETED, List.of()),
                item(2, "events", RequestStatus.COMPLETED, List.of(row("id", "e1"))),
                item(3, "orders", RequestStatus.FAILED, null));

        ExportDocument document = compiler.render(request(), items, ExportFormat.CSV, NOW);

        assertEquals("export-5.csv", document.fileName());
        assertEquals("# Table: db.public.events\nid\ne1\n", document.content());
    }

    private static Request request() {
        return Request.builder()
                .requestId(5L)
                .kind(RequestKind.EXPORT)
                .subjectType("email")
                .subjectValue("jane@example.com")
                .status(RequestStatus.COMPLETED)
                .requestedBy("jane")
                .requestedAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static RequestItem item(int sequence, String table, RequestStatus status, List<Map<String, Object>> rows) {
        Map<String, Object> resultData = new LinkedHashMap<>();
        if (rows != null) {
            resultData.put(ExportCompiler.ROWS, rows);
        }
        return RequestItem.builder()
                .requestId(5L)
                .sequence(sequence)
                .databaseName("db")
                .schemaName("public")
                .tableName(table)
                .columns(List.of("id"))
                .status(status)
                .resultData(resultData)
                .createdAt(NOW)
                .updatedAt(NOW)
                .build();
    }

    private static Map<String, Object> row(String key, Object value) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(key, value);
        return row;
    }
}

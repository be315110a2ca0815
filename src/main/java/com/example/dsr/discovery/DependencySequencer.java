package com.example.dsr.discovery;

import com.example.dsr.models.PlannedTable;
import com.example.dsr.models.TableRef;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Orders planned tables so that every table is processed before the tables it references
 * through foreign keys.
 *
 * <p>Nodes are keyed by the full database/schema/table triple. The graph is walked with a
 * tri-colour depth-first search; the post-order is reversed, which puts referencing tables
 * first. Nodes are visited in reverse input order so that tables with no relationships keep
 * their catalog order after the reversal. A back edge marks a cycle: it is logged and recorded
 * but never aborts the walk, so the result is always a complete permutation of the input.
 */
@Component
@Slf4j
public class DependencySequencer {

    private enum Mark { WHITE, GREY, BLACK }

    public SequencingResult sequence(List<PlannedTable> tables) {
        if (tables == null || tables.isEmpty()) {
            return new SequencingResult(List.of(), Set.of());
        }

        Map<String, PlannedTable> nodes = new LinkedHashMap<>();
        for (PlannedTable table : tables) {
            nodes.putIfAbsent(table.ref().normalizedKey(), table);
        }
        List<PlannedTable> distinct = new ArrayList<>(nodes.values());
        Map<String, List<String>> edges = buildEdges(distinct);

        Map<String, Mark> marks = new HashMap<>();
        List<String> postOrder = new ArrayList<>(distinct.size());
        Set<String> cyclic = new LinkedHashSet<>();

        for (int i = distinct.size() - 1; i >= 0; i--) {
            String key = distinct.get(i).ref().normalizedKey();
            if (marks.getOrDefault(key, Mark.WHITE) == Mark.WHITE) {
                visit(key, edges, marks, postOrder, cyclic, nodes);
            }
        }
        Collections.reverse(postOrder);

        List<PlannedTable> ordered = new ArrayList<>(distinct.size());
        int rank = 1;
        for (String key : postOrder) {
            ordered.add(nodes.get(key).withDeletionOrder(rank++));
        }

        Set<String> cyclicTables = new LinkedHashSet<>();
        cyclic.forEach(key -> cyclicTables.add(nodes.get(key).ref().qualifiedName()));
        return new SequencingResult(List.copyOf(ordered), Collections.unmodifiableSet(cyclicTables));
    }

    private void visit(String key,
                       Map<String, List<String>> edges,
                       Map<String, Mark> marks,
                       List<String> postOrder,
                       Set<String> cyclic,
                       Map<String, PlannedTable> nodes) {
        marks.put(key, Mark.GREY);
        for (String dependency : edges.getOrDefault(key, List.of())) {
            Mark mark = marks.getOrDefault(dependency, Mark.WHITE);
            if (mark == Mark.WHITE) {
                visit(dependency, edges, marks, postOrder, cyclic, nodes);
            } else if (mark == Mark.GREY) {
                log.warn("Circular dependency between {} and {}; continuing with best-effort order",
                        nodes.get(key).ref(), nodes.get(dependency).ref());
                cyclic.add(key);
                cyclic.add(dependency);
            }
        }
        marks.put(key, Mark.BLACK);
        postOrder.add(key);
    }

    private Map<String, List<String>> buildEdges(List<PlannedTable> tables) {
        Map<String, List<String>> edges = new HashMap<>();
        for (PlannedTable table : tables) {
            TableRef from = table.ref();
            List<String> targets = new ArrayList<>();
            for (String dependency : table.dependencies()) {
                Optional<TableRef> resolved = resolve(dependency, from, tables);
                if (resolved.isEmpty()) {
                    log.debug("Dependency {} of {} is not part of the plan", dependency, from);
                    continue;
                }
                String target = resolved.get().normalizedKey();
                if (!targets.contains(target)) {
                    targets.add(target);
                }
            }
            edges.put(from.normalizedKey(), targets);
        }
        return edges;
    }

    /**
     * Resolves a foreign-key target name against the planned tables: fully qualified names
     * first, then a table of the same database and schema, then a unique bare table name.
     */
    static Optional<TableRef> resolve(String name, TableRef from, List<PlannedTable> tables) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String wanted = name.trim().toLowerCase(Locale.ROOT);
        String[] parts = wanted.split("\\.");

        if (parts.length == 3) {
            return tables.stream()
                    .map(PlannedTable::ref)
                    .filter(ref -> ref.normalizedKey().equals(wanted))
                    .findFirst();
        }
        if (parts.length == 2) {
            return tables.stream()
                    .map(PlannedTable::ref)
                    .filter(ref -> ref.databaseName().equalsIgnoreCase(from.databaseName()))
                    .filter(ref -> ref.schemaName().equalsIgnoreCase(parts[0]))
                    .filter(ref -> ref.tableName().equalsIgnoreCase(parts[1]))
                    .findFirst();
        }

        Optional<TableRef> sameSchema = tables.stream()
                .map(PlannedTable::ref)
                .filter(ref -> ref.sameSchemaAs(from))
                .filter(ref -> ref.tableName().equalsIgnoreCase(wanted))
                .findFirst();
        if (sameSchema.isPresent()) {
            return sameSchema;
        }
        List<TableRef> byName = tables.stream()
                .map(PlannedTable::ref)
                .filter(ref -> ref.tableName().equalsIgnoreCase(wanted))
                .toList();
        return byName.size() == 1 ? Optional.of(byName.get(0)) : Optional.empty();
    }

    /**
     * @param orderedTables input tables with {@code deletion_order} assigned, in processing order
     * @param cyclicTables qualified names of tables found on a dependency cycle
     */
    public record SequencingResult(List<PlannedTable> orderedTables, Set<String> cyclicTables) {

        public boolean hasCycles() {
            return !cyclicTables.isEmpty();
        }
    }
}

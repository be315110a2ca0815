package com.example.dsr.access;

import com.example.dsr.models.AuditEvent;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

@Component
public class DynamoAuditEventAccess implements AuditEventAccess {

    public static final String TABLE_NAME = "dsr_audit_events";

    private final DynamoDbTable<AuditEvent> table;

    public DynamoAuditEventAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(AuditEvent.class));
    }

    @Override
    public void put(AuditEvent event) {
        table.putItem(event);
    }

    @Override
    public Optional<AuditEvent> findLatest(long requestId) {
        // Query the partition in reverse chronological order so the first item is the most recent.
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(requestId)))
                        .limit(1)
                        .scanIndexForward(false))
                .items()
                .stream()
                .findFirst();
    }

    @Override
    public List<AuditEvent> findAllByRequestId(long requestId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(buildKey(requestId)))
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public List<AuditEvent> findEventsOlderThan(long cutoffTimestamp) {
        Expression filterExpression = Expression.builder()
                .expression("#ts < :cutoff")
                .putExpressionName("#ts", "timestamp")
                .putExpressionValue(":cutoff", AttributeValue.builder().n(String.valueOf(cutoffTimestamp)).build())
                .build();

        ScanEnhancedRequest scanRequest = ScanEnhancedRequest.builder()
                .filterExpression(filterExpression)
                .build();

        return table.scan(scanRequest)
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public void delete(AuditEvent event) {
        Key key = Key.builder()
                .partitionValue(event.getRequestId())
                .sortValue(event.getTsUlid())
                .build();
        table.deleteItem(key);
    }

    private Key buildKey(long requestId) {
        return Key.builder().partitionValue(requestId).build();
    }
}

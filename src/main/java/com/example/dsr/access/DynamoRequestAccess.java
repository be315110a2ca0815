package com.example.dsr.access;

import com.example.dsr.models.Request;
import com.example.dsr.models.RequestStatus;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

@Component
public class DynamoRequestAccess implements RequestAccess {

    public static final String TABLE_NAME = "dsr_requests";
    public static final String COUNTERS_TABLE_NAME = "dsr_counters";
    private static final String COUNTER_KEY = "dsr_requests";

    private final DynamoDbTable<Request> table;
    private final DynamoDbClient dynamo;

    public DynamoRequestAccess(DynamoDbEnhancedClient enhancedClient, DynamoDbClient dynamo) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(Request.class));
        this.dynamo = dynamo;
    }

    @Override
    public long nextRequestId() {
        // ADD on a missing attribute starts from zero, so the first id is 1.
        UpdateItemResponse response = dynamo.updateItem(UpdateItemRequest.builder()
                .tableName(COUNTERS_TABLE_NAME)
                .key(Map.of("counter_name", AttributeValue.builder().s(COUNTER_KEY).build()))
                .updateExpression("ADD #v :one")
                .expressionAttributeNames(Map.of("#v", "current_value"))
                .expressionAttributeValues(Map.of(":one", AttributeValue.builder().n("1").build()))
                .returnValues(ReturnValue.UPDATED_NEW)
                .build());
        return Long.parseLong(response.attributes().get("current_value").n());
    }

    @Override
    public Optional<Request> findById(long requestId) {
        return Optional.ofNullable(table.getItem(r -> r.key(Key.builder()
                        .partitionValue(requestId)
                        .build())
                .consistentRead(true)));
    }

    @Override
    public Request save(Request request) {
        table.putItem(request);
        return request;
    }

    @Override
    public boolean saveIfStatus(Request request, RequestStatus expected) {
        try {
            table.putItem(r -> r.item(request)
                    .conditionExpression(Expression.builder()
                            .expression("#status = :expected")
                            .putExpressionName("#status", "status")
                            .putExpressionValue(":expected", AttributeValue.builder().s(expected.name()).build())
                            .build()));
            return true;
        } catch (ConditionalCheckFailedException ex) {
            return false;
        }
    }

    @Override
    public List<Request> find(RequestQuery query) {
        List<String> clauses = new ArrayList<>();
        Expression.Builder filter = Expression.builder();
        if (query.kind() != null) {
            clauses.add("#kind = :kind");
            filter.putExpressionName("#kind", "kind")
                    .putExpressionValue(":kind", AttributeValue.builder().s(query.kind().name()).build());
        }
        if (query.status() != null) {
            clauses.add("#status = :status");
            filter.putExpressionName("#status", "status")
                    .putExpressionValue(":status", AttributeValue.builder().s(query.status().name()).build());
        }
        if (query.subjectType() != null) {
            clauses.add("#st = :st");
            filter.putExpressionName("#st", "subject_type")
                    .putExpressionValue(":st", AttributeValue.builder().s(query.subjectType()).build());
        }
        if (query.requestedBy() != null) {
            clauses.add("#rb = :rb");
            filter.putExpressionName("#rb", "requested_by")
                    .putExpressionValue(":rb", AttributeValue.builder().s(query.requestedBy()).build());
        }

        ScanEnhancedRequest.Builder scan = ScanEnhancedRequest.builder();
        if (!clauses.isEmpty()) {
            scan.filterExpression(filter.expression(String.join(" AND ", clauses)).build());
        }

        // A scan has no ordering, so sort and trim after the filter has been applied.
        return table.scan(scan.build())
                .items()
                .stream()
                .sorted(Comparator.comparing(Request::getRequestedAt).reversed()
                        .thenComparing(Comparator.comparing(Request::getRequestId).reversed()))
                .limit(query.effectiveLimit())
                .collect(Collectors.toList());
    }

    @Override
    public List<Request> findQueuedBefore(long cutoffTimestamp) {
        Expression filterExpression = Expression.builder()
                .expression("#status = :pending AND #queued < :cutoff")
                .putExpressionName("#status", "status")
                .putExpressionName("#queued", "queued_at")
                .putExpressionValue(":pending", AttributeValue.builder().s(RequestStatus.PENDING.name()).build())
                .putExpressionValue(":cutoff", AttributeValue.builder().n(String.valueOf(cutoffTimestamp)).build())
                .build();

        return table.scan(ScanEnhancedRequest.builder().filterExpression(filterExpression).build())
                .items()
                .stream()
                .sorted(Comparator.comparing(Request::getQueuedAt))
                .collect(Collectors.toList());
    }
}

package com.example.dsr.access;

import com.example.dsr.models.RequestItem;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.QueryConditional;

@Component
public class DynamoRequestItemAccess implements RequestItemAccess {

    public static final String TABLE_NAME = "dsr_request_items";

    private final DynamoDbTable<RequestItem> table;

    public DynamoRequestItemAccess(DynamoDbEnhancedClient enhancedClient) {
        this.table = enhancedClient.table(TABLE_NAME, TableSchema.fromBean(RequestItem.class));
    }

    @Override
    public List<RequestItem> findAllByRequestId(long requestId) {
        return table.query(r -> r.queryConditional(QueryConditional.keyEqualTo(
                                Key.builder().partitionValue(requestId).build()))
                        .consistentRead(true)
                        .scanIndexForward(true))
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public RequestItem save(RequestItem item) {
        table.putItem(item);
        return item;
    }
}

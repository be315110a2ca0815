package com.example.dsr.config;

import com.example.dsr.access.DynamoAuditEventAccess;
import com.example.dsr.access.DynamoMetadataCatalog;
import com.example.dsr.access.DynamoRequestAccess;
import com.example.dsr.access.DynamoRequestItemAccess;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.CatalogColumn;
import com.example.dsr.models.CatalogForeignKey;
import com.example.dsr.models.CatalogTable;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.BillingMode;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceInUseException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

/**
 * Creates the service's tables on startup when they are missing. Meant for LocalStack and
 * local development; production tables are provisioned outside the service.
 */
@Component
@Slf4j
@ConditionalOnProperty(value = "dsr.dynamo.create-tables", havingValue = "true")
public class DynamoTableBootstrap implements ApplicationRunner {

    private final DynamoDbClient dynamo;
    private final DynamoDbEnhancedClient enhancedClient;

    public DynamoTableBootstrap(DynamoDbClient dynamo, DynamoDbEnhancedClient enhancedClient) {
        this.dynamo = dynamo;
        this.enhancedClient = enhancedClient;
    }

    @Override
    public void run(ApplicationArguments args) {
        createMissingTables();
    }

    public void createMissingTables() {
        createIfMissing(DynamoRequestAccess.TABLE_NAME, () -> enhancedClient
                .table(DynamoRequestAccess.TABLE_NAME, TableSchema.fromBean(Request.class)).createTable());
        createIfMissing(DynamoRequestItemAccess.TABLE_NAME, () -> enhancedClient
                .table(DynamoRequestItemAccess.TABLE_NAME, TableSchema.fromBean(RequestItem.class)).createTable());
        createIfMissing(DynamoAuditEventAccess.TABLE_NAME, () -> enhancedClient
                .table(DynamoAuditEventAccess.TABLE_NAME, TableSchema.fromBean(AuditEvent.class)).createTable());
        createIfMissing(DynamoMetadataCatalog.TABLES_TABLE, () -> enhancedClient
                .table(DynamoMetadataCatalog.TABLES_TABLE, TableSchema.fromBean(CatalogTable.class)).createTable());
        createIfMissing(DynamoMetadataCatalog.COLUMNS_TABLE, () -> enhancedClient
                .table(DynamoMetadataCatalog.COLUMNS_TABLE, TableSchema.fromBean(CatalogColumn.class)).createTable());
        createIfMissing(DynamoMetadataCatalog.FOREIGN_KEYS_TABLE, () -> enhancedClient
                .table(DynamoMetadataCatalog.FOREIGN_KEYS_TABLE, TableSchema.fromBean(CatalogForeignKey.class))
                .createTable());
        createIfMissing(DynamoRequestAccess.COUNTERS_TABLE_NAME, () -> dynamo.createTable(CreateTableRequest.builder()
                .tableName(DynamoRequestAccess.COUNTERS_TABLE_NAME)
                .keySchema(KeySchemaElement.builder().attributeName("counter_name").keyType(KeyType.HASH).build())
                .attributeDefinitions(AttributeDefinition.builder()
                        .attributeName("counter_name")
                        .attributeType(ScalarAttributeType.S)
                        .build())
                .billingMode(BillingMode.PAY_PER_REQUEST)
                .build()));
    }

    private void createIfMissing(String tableName, Runnable create) {
        try {
            create.run();
            log.info("Created DynamoDB table {}", tableName);
        } catch (ResourceInUseException ex) {
            log.debug("DynamoDB table {} already exists", tableName);
        }
    }
}

package com.example.dsr.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.dsr.config.DynamoTableBootstrap;
import com.example.dsr.models.AuditEvent;
import com.example.dsr.models.Request;
import com.example.dsr.models.RequestItem;
import com.example.dsr.models.RequestKind;
import com.example.dsr.models.RequestStatus;
import com.example.dsr.service.AuditLogService;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoRequestAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private DynamoDbEnhancedClient enhancedClient;
    private RequestAccess requestAccess;
    private RequestItemAccess requestItemAccess;
    private AuditEventAccess auditEventAccess;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        DynamoDbClient dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
        new DynamoTableBootstrap(dynamo, enhancedClient).createMissingTables();

        requestAccess = new DynamoRequestAccess(enhancedClient, dynamo);
        requestItemAccess = new DynamoRequestItemAccess(enhancedClient);
        auditEventAccess = new DynamoAuditEventAccess(enhancedClient);
    }

    @BeforeEach
    void cleanup() {
        var requests = enhancedClient.table(DynamoRequestAccess.TABLE_NAME, TableSchema.fromBean(Request.class));
        requests.scan().items().forEach(requests::deleteItem);
        var items = enhancedClient.table(DynamoRequestItemAccess.TABLE_NAME, TableSchema.fromBean(RequestItem.class));
        items.scan().items().forEach(items::deleteItem);
        var events = enhancedClient.table(DynamoAuditEventAccess.TABLE_NAME, TableSchema.fromBean(AuditEvent.class));
        events.scan().items().forEach(events::deleteItem);
    }

    @Test
    @DisplayName("nextRequestId hands out increasing ids")
    void nextRequestIdIncrements() {
        long first = requestAccess.nextRequestId();
        long second = requestAccess.nextRequestId();

        assertTrue(first >= 1);
        assertEquals(first + 1, second);
    }

    @Test
    @DisplayName("metadata documents survive a round trip")
    void metadataRoundTrip() {
        Map<String, Object> options = new LinkedHashMap<>();
        options.put("soft_delete", true);
        options.put("verification_required", false);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(Request.META_OPTIONS, options);
        metadata.put(Request.META_NOTES, Map.of("ticket", "PRIV-1"));

        long id = requestAccess.nextRequestId();
        requestAccess.save(request(id, RequestStatus.PENDING, null).toBuilder().metadata(metadata).build());

        Request stored = requestAccess.findById(id).orElseThrow();
        assertEquals(RequestKind.DELETE, stored.getKind());
        assertEquals(RequestStatus.PENDING, stored.getStatus());
        assertEquals(options, stored.getMetadata().get(Request.META_OPTIONS));
        assertEquals(Map.of("ticket", "PRIV-1"), stored.getMetadata().get(Request.META_NOTES));
    }

    @Test
    @DisplayName("saveIfStatus only writes when the stored status matches")
    void saveIfStatusCompareAndSet() {
        long id = requestAccess.nextRequestId();
        Request pending = requestAccess.save(request(id, RequestStatus.PENDING, null));

        Request processing = pending.toBuilder().status(RequestStatus.PROCESSING).build();
        assertTrue(requestAccess.saveIfStatus(processing, RequestStatus.PENDING));

        Request cancelled = pending.toBuilder().status(RequestStatus.CANCELLED).build();
        assertFalse(requestAccess.saveIfStatus(cancelled, RequestStatus.PENDING));
        assertEquals(RequestStatus.PROCESSING, requestAccess.findById(id).orElseThrow().getStatus());
    }

    @Test
    @DisplayName("find filters by kind and status, newest first, up to the limit")
    void findFiltersAndOrders() {
        long now = CLOCK.millis();
        requestAccess.save(request(1L, RequestStatus.PENDING, null).toBuilder().requestedAt(now).build());
        requestAccess.save(request(2L, RequestStatus.PENDING, null).toBuilder().requestedAt(now + 1000).build());
        requestAccess.save(request(3L, RequestStatus.COMPLETED, null).toBuilder().requestedAt(now + 2000).build());
        requestAccess.save(request(4L, RequestStatus.PENDING, null).toBuilder()
                .kind(RequestKind.EXPORT).requestedAt(now + 3000).build());

        List<Request> pendingDeletes = requestAccess.find(
                new RequestQuery(RequestKind.DELETE, RequestStatus.PENDING, null, null, null));
        assertEquals(List.of(2L, 1L), pendingDeletes.stream().map(Request::getRequestId).toList());

        List<Request> latest = requestAccess.find(new RequestQuery(null, null, null, null, 1));
        assertEquals(List.of(4L), latest.stream().map(Request::getRequestId).toList());
    }

    @Test
    @DisplayName("findQueuedBefore returns pending requests queued before the cutoff")
    void findQueuedBefore() {
        long now = CLOCK.millis();
        requestAccess.save(request(1L, RequestStatus.PENDING, now - 60_000));
        requestAccess.save(request(2L, RequestStatus.PENDING, now - 120_000));
        requestAccess.save(request(3L, RequestStatus.PENDING, now));
        requestAccess.save(request(4L, RequestStatus.PENDING, null));
        requestAccess.save(request(5L, RequestStatus.PROCESSING, now - 120_000));

        List<Request> queued = requestAccess.findQueuedBefore(now - 30_000);

        assertEquals(List.of(2L, 1L), queued.stream().map(Request::getRequestId).toList());
    }

    @Test
    @DisplayName("request items come back in sequence order")
    void itemsInSequenceOrder() {
        long now = CLOCK.millis();
        requestItemAccess.save(item(7L, 2, "orders", now));
        requestItemAccess.save(item(7L, 1, "users", now));
        requestItemAccess.save(item(8L, 1, "other", now));

        List<RequestItem> items = requestItemAccess.findAllByRequestId(7L);

        assertEquals(List.of("users", "orders"), items.stream().map(RequestItem::getTableName).toList());
        assertEquals(List.of("user_id"), items.get(0).getColumns());
    }

    @Test
    @DisplayName("audit trail is read in chain order and the latest event is found")
    void auditTrailOrdering() {
        AuditLogService auditLogService = new AuditLogService(auditEventAccess, CLOCK);
        Request request = request(9L, RequestStatus.PENDING, null);

        auditLogService.recordSubmitted(request);
        auditLogService.recordApproved(request, "dpo");
        auditLogService.recordProcessingStarted(request);

        List<AuditEvent> trail = auditEventAccess.findAllByRequestId(9L);
        assertEquals(3, trail.size());
        assertEquals(AuditEvent.EventType.APPROVED, trail.get(1).getEventType());
        assertEquals(trail.get(0).getHash(), trail.get(1).getPrevHash());
        assertEquals(AuditEvent.EventType.PROCESSING_STARTED,
                auditEventAccess.findLatest(9L).orElseThrow().getEventType());
    }

    private static Request request(long id, RequestStatus status, Long queuedAt) {
        long now = CLOCK.millis();
        return Request.builder()
                .requestId(id)
                .kind(RequestKind.DELETE)
                .subjectType("email")
                .subjectValue("jane@example.com")
                .status(status)
                .requestedBy("jane")
                .requestedAt(now)
                .updatedAt(now)
                .queuedAt(queuedAt)
                .build();
    }

    private static RequestItem item(long requestId, int sequence, String table, long now) {
        return RequestItem.builder()
                .requestId(requestId)
                .sequence(sequence)
                .databaseName("shop")
                .schemaName("public")
                .tableName(table)
                .columns(List.of("user_id"))
                .status(RequestStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}

package com.example.accesslog.access;

import com.example.accesslog.config.AccessLogProperties;
import com.example.accesslog.models.Identifier;
import com.example.accesslog.models.IdentifierAttributeConverter;
import com.example.accesslog.models.LogEntry;
import com.example.accesslog.models.LogFilter;
import com.example.accesslog.models.RemoteOriginAttributeConverter;
import java.net.InetAddress;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Expression;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.enhanced.dynamodb.model.ScanEnhancedRequest;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;
import software.amazon.awssdk.services.dynamodb.model.ScanRequest;
import software.amazon.awssdk.services.dynamodb.model.ScanResponse;
import software.amazon.awssdk.services.dynamodb.model.Select;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

@Component
@Slf4j
public class DynamoAccessLogAccess implements AccessLogAccess {

    private final DynamoDbClient dynamo;
    private final DynamoDbTable<LogEntry> table;
    private final String tableName;

    public DynamoAccessLogAccess(DynamoDbClient dynamo,
                                 DynamoDbEnhancedClient enhancedClient,
                                 AccessLogProperties properties) {
        this.dynamo = dynamo;
        this.tableName = properties.tableName();
        this.table = enhancedClient.table(tableName, TableSchema.fromBean(LogEntry.class));
    }

    @Override
    public void install() {
        try {
            dynamo.describeTable(b -> b.tableName(tableName));
        } catch (ResourceNotFoundException ex) {
            log.info("Creating table {}", tableName);
            dynamo.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .attributeDefinitions(AttributeDefinition.builder()
                            .attributeName(LogEntry.ID)
                            .attributeType(ScalarAttributeType.B)
                            .build())
                    .keySchema(KeySchemaElement.builder()
                            .attributeName(LogEntry.ID)
                            .keyType(KeyType.HASH)
                            .build())
                    .billingMode("PAY_PER_REQUEST")
                    .build());
            dynamo.waiter().waitUntilTableExists(b -> b.tableName(tableName));
        }
    }

    @Override
    public void uninstall() {
        log.info("Dropping table {}", tableName);
        dynamo.deleteTable(b -> b.tableName(tableName));
    }

    @Override
    public LogEntry insert(LogEntry entry) {
        // The uniqueness guard: a racing insert of the same id fails here even if its preflight passed.
        table.putItem(r -> r.item(entry)
                .conditionExpression(Expression.builder()
                        .expression("attribute_not_exists(#id)")
                        .putExpressionName("#id", LogEntry.ID)
                        .build()));
        return entry;
    }

    @Override
    public List<LogEntry> find(LogFilter filter) {
        ScanEnhancedRequest.Builder scanRequest = ScanEnhancedRequest.builder().consistentRead(true);
        LogFilterExpressions.toExpression(filter).ifPresent(scanRequest::filterExpression);

        return table.scan(scanRequest.build())
                .items()
                .stream()
                .collect(Collectors.toList());
    }

    @Override
    public long count(LogFilter filter) {
        ScanRequest.Builder scanRequest = scanBuilder(LogFilterExpressions.toExpression(filter))
                .select(Select.COUNT);

        return dynamo.scanPaginator(scanRequest.build())
                .stream()
                .mapToLong(ScanResponse::count)
                .sum();
    }

    @Override
    public void deleteById(Identifier id) {
        table.deleteItem(key(id));
    }

    @Override
    public int deleteCreatedBefore(OptionalLong cutoff) {
        Expression condition = LogFilterExpressions.datedBefore(cutoff.isPresent() ? cutoff.getAsLong() : null);
        List<Identifier> ids = scanIds(condition).collect(Collectors.toList());

        ids.forEach(id -> table.deleteItem(key(id)));
        return ids.size();
    }

    @Override
    public SortedSet<String> findScopes() {
        ScanRequest scanRequest = ScanRequest.builder()
                .tableName(tableName)
                .consistentRead(true)
                .projectionExpression("#scope")
                .expressionAttributeNames(Map.of("#scope", LogEntry.SCOPE))
                .build();

        return dynamo.scanPaginator(scanRequest)
                .items()
                .stream()
                .map(item -> item.get(LogEntry.SCOPE))
                .map(value -> value == null || value.s() == null ? "" : value.s())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    @Override
    public int replaceSubjectId(Identifier oldId, Identifier newId) {
        return replaceIdentifier(LogEntry.SUBJECT_ID, oldId, newId);
    }

    @Override
    public int replaceObjectId(Identifier oldId, Identifier newId) {
        return replaceIdentifier(LogEntry.OBJECT_ID, oldId, newId);
    }

    @Override
    public boolean updateRemoteOrigin(Identifier id, InetAddress remoteOrigin) {
        try {
            dynamo.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of(LogEntry.ID, IdentifierAttributeConverter.toAttributeValue(id)))
                    .updateExpression("SET #origin = :origin")
                    .conditionExpression("attribute_exists(#id)")
                    .expressionAttributeNames(Map.of("#origin", LogEntry.REMOTE_ORIGIN, "#id", LogEntry.ID))
                    .expressionAttributeValues(Map.of(":origin",
                            RemoteOriginAttributeConverter.toAttributeValue(remoteOrigin)))
                    .build());
            return true;
        } catch (ConditionalCheckFailedException ex) {
            log.debug("Skipping remote origin update for missing log {}", id);
            return false;
        }
    }

    /**
     * Rewrites one identifier attribute row by row. Each update is conditional on the attribute
     * still holding the old value, so rows changed or deleted since the scan are left alone.
     */
    private int replaceIdentifier(String attribute, Identifier oldId, Identifier newId) {
        List<Identifier> ids = scanIds(LogFilterExpressions.attributeEquals(attribute, oldId))
                .collect(Collectors.toList());

        int updated = 0;
        for (Identifier id : ids) {
            try {
                dynamo.updateItem(UpdateItemRequest.builder()
                        .tableName(tableName)
                        .key(Map.of(LogEntry.ID, IdentifierAttributeConverter.toAttributeValue(id)))
                        .updateExpression("SET #attr = :new")
                        .conditionExpression("#attr = :old")
                        .expressionAttributeNames(Map.of("#attr", attribute))
                        .expressionAttributeValues(Map.of(
                                ":new", IdentifierAttributeConverter.toAttributeValue(newId),
                                ":old", IdentifierAttributeConverter.toAttributeValue(oldId)))
                        .build());
                updated++;
            } catch (ConditionalCheckFailedException ex) {
                log.debug("Log {} no longer holds the old {}, skipping", id, attribute);
            }
        }
        return updated;
    }

    private Stream<Identifier> scanIds(Expression filter) {
        ScanRequest.Builder scanRequest = scanBuilder(Optional.of(filter));
        Map<String, String> names = new HashMap<>(filter.expressionNames());
        names.put("#id", LogEntry.ID);
        scanRequest.projectionExpression("#id").expressionAttributeNames(names);

        return dynamo.scanPaginator(scanRequest.build())
                .items()
                .stream()
                .map(item -> Identifier.fromBytes(item.get(LogEntry.ID).b().asByteArray()));
    }

    private ScanRequest.Builder scanBuilder(Optional<Expression> filter) {
        ScanRequest.Builder scanRequest = ScanRequest.builder()
                .tableName(tableName)
                .consistentRead(true);
        filter.ifPresent(expression -> {
            scanRequest.filterExpression(expression.expression())
                    .expressionAttributeNames(expression.expressionNames());
            Map<String, AttributeValue> values = expression.expressionValues();
            if (values != null && !values.isEmpty()) {
                scanRequest.expressionAttributeValues(values);
            }
        });
        return scanRequest;
    }

    private Key key(Identifier id) {
        return Key.builder()
                .partitionValue(IdentifierAttributeConverter.toAttributeValue(id).b())
                .build();
    }
}

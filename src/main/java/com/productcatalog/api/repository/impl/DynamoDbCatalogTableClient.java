package com.productcatalog.api.repository.impl;

import com.productcatalog.api.config.CatalogProperties;
import com.productcatalog.api.exception.DatabaseException;
import com.productcatalog.api.exception.DuplicateException;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.repository.CatalogTableClient;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.IndexQuery;
import com.productcatalog.api.util.ItemKey;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.PaginationTokenCodec;
import com.productcatalog.api.util.QueryPerformanceTracker;
import com.productcatalog.api.util.UpdateStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * CatalogTableClient over the DynamoDB low-level client.
 * Every call is timed by the QueryPerformanceTracker.
 */
@Repository
public class DynamoDbCatalogTableClient implements CatalogTableClient {

    private static final Logger logger = LoggerFactory.getLogger(DynamoDbCatalogTableClient.class);

    static final int BATCH_GET_LIMIT = 100;
    static final int BATCH_WRITE_LIMIT = 25;

    private final DynamoDbClient dynamoDbClient;
    private final QueryPerformanceTracker queryTracker;
    private final String tableName;

    @Autowired
    public DynamoDbCatalogTableClient(DynamoDbClient dynamoDbClient, QueryPerformanceTracker queryTracker,
                                      CatalogProperties catalogProperties) {
        this.dynamoDbClient = dynamoDbClient;
        this.queryTracker = queryTracker;
        this.tableName = catalogProperties.getTableName();
    }

    @Override
    public Optional<Map<String, AttributeValue>> get(ItemKey key) {
        return queryTracker.trackCall("GetItem", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key.toAttributeMap())
                    .build());

                if (!response.hasItem() || response.item().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(response.item());

            } catch (SdkException e) {
                logger.error("Failed to get item {}", key, e);
                throw new DatabaseException("Failed to get item: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void put(Map<String, AttributeValue> item, String conditionExpression) {
        queryTracker.trackCall("PutItem", tableName, () -> {
            PutItemRequest.Builder request = PutItemRequest.builder()
                .tableName(tableName)
                .item(item);
            if (conditionExpression != null) {
                request.conditionExpression(conditionExpression);
            }

            try {
                dynamoDbClient.putItem(request.build());
                logger.debug("Put item {}", describeKey(item));
                return null;

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Put condition failed for item {}", describeKey(item));
                throw new DuplicateException("Item already exists", e);
            } catch (SdkException e) {
                logger.error("Failed to put item {}", describeKey(item), e);
                throw new DatabaseException("Failed to put item: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Map<String, AttributeValue> update(ItemKey key, UpdateStatement update, String conditionExpression) {
        if (update.isEmpty()) {
            throw new IllegalArgumentException("Update statement has no attributes");
        }
        return queryTracker.trackCall("UpdateItem", tableName, () -> {
            UpdateItemRequest.Builder request = UpdateItemRequest.builder()
                .tableName(tableName)
                .key(key.toAttributeMap())
                .updateExpression(update.toExpression())
                .expressionAttributeNames(update.toAttributeNames())
                .returnValues(ReturnValue.ALL_NEW);
            Map<String, AttributeValue> values = update.toAttributeValues();
            if (!values.isEmpty()) {
                request.expressionAttributeValues(values);
            }
            if (conditionExpression != null) {
                request.conditionExpression(conditionExpression);
            }

            try {
                UpdateItemResponse response = dynamoDbClient.updateItem(request.build());
                logger.debug("Updated item {}", key);
                return response.attributes();

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Update condition failed for item {}", key);
                throw new NotFoundException("Item not found", e);
            } catch (SdkException e) {
                logger.error("Failed to update item {}", key, e);
                throw new DatabaseException("Failed to update item: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public Optional<Map<String, AttributeValue>> delete(ItemKey key, String conditionExpression) {
        return queryTracker.trackCall("DeleteItem", tableName, () -> {
            DeleteItemRequest.Builder request = DeleteItemRequest.builder()
                .tableName(tableName)
                .key(key.toAttributeMap())
                .returnValues(ReturnValue.ALL_OLD);
            if (conditionExpression != null) {
                request.conditionExpression(conditionExpression);
            }

            try {
                DeleteItemResponse response = dynamoDbClient.deleteItem(request.build());
                logger.debug("Deleted item {}", key);
                if (!response.hasAttributes() || response.attributes().isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(response.attributes());

            } catch (ConditionalCheckFailedException e) {
                logger.warn("Delete condition failed for item {}", key);
                throw new NotFoundException("Item not found", e);
            } catch (SdkException e) {
                logger.error("Failed to delete item {}", key, e);
                throw new DatabaseException("Failed to delete item: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public boolean exists(ItemKey key) {
        return queryTracker.trackCall("GetItem-Exists", tableName, () -> {
            try {
                GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(key.toAttributeMap())
                    .projectionExpression("#pk")
                    .expressionAttributeNames(Map.of("#pk", CatalogKeyFactory.PK_FIELD))
                    .build());
                return response.hasItem() && !response.item().isEmpty();

            } catch (SdkException e) {
                logger.error("Failed to check existence of item {}", key, e);
                throw new DatabaseException("Failed to check item: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public PaginatedResult<Map<String, AttributeValue>> queryByIndex(IndexQuery query, int limit, String continuationToken) {
        Map<String, AttributeValue> startKey = PaginationTokenCodec.decodeQueryStartKey(continuationToken, query);

        return queryTracker.trackCall("Query-" + query.getIndexName(), tableName, () -> {
            Map<String, String> names = new HashMap<>();
            Map<String, AttributeValue> values = new HashMap<>();
            names.put("#pk", query.getPkField());
            values.put(":pk", AttributeValue.builder().s(query.getPkValue()).build());
            String keyCondition = "#pk = :pk";
            if (query.hasSkPrefix()) {
                names.put("#sk", query.getSkField());
                values.put(":sk_prefix", AttributeValue.builder().s(query.getSkPrefix()).build());
                keyCondition += " AND begins_with(#sk, :sk_prefix)";
            }

            QueryRequest.Builder request = QueryRequest.builder()
                .tableName(tableName)
                .indexName(query.getIndexName())
                .keyConditionExpression(keyCondition)
                .expressionAttributeNames(names)
                .expressionAttributeValues(values)
                .scanIndexForward(true)
                .limit(limit);
            if (startKey != null) {
                request.exclusiveStartKey(startKey);
            }

            try {
                QueryResponse response = dynamoDbClient.query(request.build());
                logger.debug("Query on {} for {} returned {} items", query.getIndexName(), query.getPkValue(),
                    response.count());
                return new PaginatedResult<>(response.items(), PaginationTokenCodec.encode(response.lastEvaluatedKey()));

            } catch (SdkException e) {
                logger.error("Failed to query index {} for {}", query.getIndexName(), query.getPkValue(), e);
                throw new DatabaseException("Failed to query index: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public PaginatedResult<Map<String, AttributeValue>> scanByTypePrefix(String typePrefix, int limit, String continuationToken) {
        IndexQuery index = CatalogKeyFactory.entityListIndex(typePrefix);
        Map<String, AttributeValue> startKey = PaginationTokenCodec.decodeScanStartKey(continuationToken, index);

        return queryTracker.trackCall("Scan-" + index.getIndexName(), tableName, () -> {
            ScanRequest.Builder request = ScanRequest.builder()
                .tableName(tableName)
                .indexName(index.getIndexName())
                .filterExpression("begins_with(#sk, :prefix)")
                .expressionAttributeNames(Map.of("#sk", index.getPkField()))
                .expressionAttributeValues(Map.of(":prefix", AttributeValue.builder().s(index.getPkValue()).build()))
                .limit(limit);
            if (startKey != null) {
                request.exclusiveStartKey(startKey);
            }

            try {
                ScanResponse response = dynamoDbClient.scan(request.build());
                return new PaginatedResult<>(response.items(), PaginationTokenCodec.encode(response.lastEvaluatedKey()));

            } catch (SdkException e) {
                logger.error("Failed to list items with prefix {}", typePrefix, e);
                throw new DatabaseException("Failed to list items: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public List<Map<String, AttributeValue>> batchGet(List<ItemKey> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.of();
        }
        return queryTracker.trackCall("BatchGetItem", tableName, () -> {
            List<Map<String, AttributeValue>> items = new ArrayList<>();
            try {
                // BatchGetItem accepts at most 100 keys per call
                for (int i = 0; i < keys.size(); i += BATCH_GET_LIMIT) {
                    List<Map<String, AttributeValue>> chunk = new ArrayList<>();
                    for (ItemKey key : keys.subList(i, Math.min(i + BATCH_GET_LIMIT, keys.size()))) {
                        chunk.add(key.toAttributeMap());
                    }

                    BatchGetItemResponse response = dynamoDbClient.batchGetItem(BatchGetItemRequest.builder()
                        .requestItems(Map.of(tableName, KeysAndAttributes.builder().keys(chunk).build()))
                        .build());
                    if (response.hasUnprocessedKeys() && !response.unprocessedKeys().isEmpty()) {
                        logger.warn("Batch get left {} unprocessed keys", countKeys(response.unprocessedKeys()));
                        throw new DatabaseException("Batch get left unprocessed keys");
                    }
                    items.addAll(response.responses().getOrDefault(tableName, List.of()));
                }
                return items;

            } catch (SdkException e) {
                logger.error("Failed to batch get {} items", keys.size(), e);
                throw new DatabaseException("Failed to batch get items: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public void batchWrite(List<Map<String, AttributeValue>> puts, List<ItemKey> deletes) {
        List<WriteRequest> requests = new ArrayList<>();
        if (puts != null) {
            puts.forEach(item -> requests.add(WriteRequest.builder()
                .putRequest(PutRequest.builder().item(item).build())
                .build()));
        }
        if (deletes != null) {
            deletes.forEach(key -> requests.add(WriteRequest.builder()
                .deleteRequest(DeleteRequest.builder().key(key.toAttributeMap()).build())
                .build()));
        }
        if (requests.isEmpty()) {
            return;
        }

        queryTracker.trackCall("BatchWriteItem", tableName, () -> {
            try {
                // BatchWriteItem accepts at most 25 requests per call
                for (int i = 0; i < requests.size(); i += BATCH_WRITE_LIMIT) {
                    BatchWriteItemResponse response = dynamoDbClient.batchWriteItem(BatchWriteItemRequest.builder()
                        .requestItems(Map.of(tableName,
                            requests.subList(i, Math.min(i + BATCH_WRITE_LIMIT, requests.size()))))
                        .build());
                    if (response.hasUnprocessedItems() && !response.unprocessedItems().isEmpty()) {
                        logger.warn("Batch write left {} unprocessed requests",
                            response.unprocessedItems().values().stream().mapToInt(List::size).sum());
                        throw new DatabaseException("Batch write left unprocessed items");
                    }
                }
                logger.debug("Batch wrote {} requests", requests.size());
                return null;

            } catch (SdkException e) {
                logger.error("Failed to batch write {} requests", requests.size(), e);
                throw new DatabaseException("Failed to batch write items: " + e.getMessage(), e);
            }
        });
    }

    private static int countKeys(Map<String, KeysAndAttributes> unprocessed) {
        return unprocessed.values().stream().mapToInt(keys -> keys.keys().size()).sum();
    }

    private static String describeKey(Map<String, AttributeValue> item) {
        AttributeValue pk = item.get(CatalogKeyFactory.PK_FIELD);
        AttributeValue sk = item.get(CatalogKeyFactory.SK_FIELD);
        return (pk == null ? "?" : pk.s()) + "/" + (sk == null ? "?" : sk.s());
    }
}

package com.productcatalog.api.repository;

import com.productcatalog.api.util.IndexQuery;
import com.productcatalog.api.util.ItemKey;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.UpdateStatement;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Item-level access to the single catalog table.
 *
 * Failures are reported with the catalog exception taxonomy:
 * a failed condition on {@link #put} is a {@code DuplicateException}, a failed condition on
 * {@link #update} or {@link #delete} is a {@code NotFoundException}, and any other store
 * failure is a {@code DatabaseException}. Nothing is retried beyond the SDK's own policy.
 */
public interface CatalogTableClient {

    /** Condition that holds only when no item exists under the key. */
    String ITEM_NOT_EXISTS = "attribute_not_exists(PK)";

    /** Condition that holds only when an item exists under the key. */
    String ITEM_EXISTS = "attribute_exists(PK)";

    Optional<Map<String, AttributeValue>> get(ItemKey key);

    /**
     * @param conditionExpression optional condition, null for an unconditional put
     */
    void put(Map<String, AttributeValue> item, String conditionExpression);

    /**
     * @return every attribute of the item after the update
     */
    Map<String, AttributeValue> update(ItemKey key, UpdateStatement update, String conditionExpression);

    /**
     * @return the deleted item, or empty when nothing was stored under the key
     */
    Optional<Map<String, AttributeValue>> delete(ItemKey key, String conditionExpression);

    boolean exists(ItemKey key);

    /**
     * Query one secondary index partition in sort-key order.
     *
     * @param continuationToken token from a previous page of the same query, or null for the first page
     * @throws com.productcatalog.api.exception.ValidationException if the token is malformed or
     *         belongs to another index or partition
     */
    PaginatedResult<Map<String, AttributeValue>> queryByIndex(IndexQuery query, int limit, String continuationToken);

    /**
     * List items whose sort key starts with {@code typePrefix#}, read through the inverted GSI-1.
     * The prefix is applied as a filter, so a page may hold fewer than {@code limit} items
     * while a continuation token is still returned.
     */
    PaginatedResult<Map<String, AttributeValue>> scanByTypePrefix(String typePrefix, int limit, String continuationToken);

    /**
     * Fetch many items by key. Missing keys are left out of the result; order is not preserved.
     * Keys the store leaves unprocessed are not resent: the call fails with a
     * {@code DatabaseException} instead.
     */
    List<Map<String, AttributeValue>> batchGet(List<ItemKey> keys);

    /**
     * Write and delete in chunks. Like {@link #batchGet}, unprocessed requests fail the call.
     */
    void batchWrite(List<Map<String, AttributeValue>> puts, List<ItemKey> deletes);
}

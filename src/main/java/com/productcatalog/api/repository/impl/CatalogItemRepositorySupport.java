package com.productcatalog.api.repository.impl;

import com.productcatalog.api.model.BaseItem;
import com.productcatalog.api.repository.CatalogTableClient;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.IndexQuery;
import com.productcatalog.api.util.ItemKey;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.UpdateStatement;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Shared plumbing for the entity repositories: bean mapping through the enhanced client's
 * TableSchema, point operations keyed by entity prefix and the GSI-3 name lookup.
 */
abstract class CatalogItemRepositorySupport<T extends BaseItem> {

    protected final CatalogTableClient tableClient;
    protected final TableSchema<T> schema;
    private final String typePrefix;

    protected CatalogItemRepositorySupport(CatalogTableClient tableClient, Class<T> beanClass, String typePrefix) {
        this.tableClient = tableClient;
        this.schema = TableSchema.fromBean(beanClass);
        this.typePrefix = typePrefix;
    }

    protected ItemKey keyOf(String id) {
        return ItemKey.of(CatalogKeyFactory.getEntityPk(typePrefix, id), CatalogKeyFactory.getEntitySk(typePrefix, id));
    }

    protected Map<String, AttributeValue> toItem(T bean) {
        return schema.itemToMap(bean, true);
    }

    protected T toBean(Map<String, AttributeValue> item) {
        return schema.mapToItem(item);
    }

    protected void putNew(T bean) {
        tableClient.put(toItem(bean), CatalogTableClient.ITEM_NOT_EXISTS);
    }

    protected Optional<T> findByKey(ItemKey key) {
        return tableClient.get(key).map(this::toBean);
    }

    protected T updateExisting(ItemKey key, UpdateStatement update) {
        return toBean(tableClient.update(key, update, CatalogTableClient.ITEM_EXISTS));
    }

    protected PaginatedResult<T> queryPage(IndexQuery query, int limit, String continuationToken) {
        return tableClient.queryByIndex(query, limit, continuationToken).map(this::toBean);
    }

    /**
     * Start an update that refreshes updated_at.
     */
    protected static UpdateStatement newUpdate(Instant now) {
        return new UpdateStatement().set("updated_at", now.toString());
    }

    /**
     * Look for another entity in a GSI-3 list partition whose name matches ignoring case and
     * surrounding whitespace. Only the first {@code pageSize} candidates are inspected.
     */
    protected boolean nameTaken(String listPartition, String name, String excludeId, int pageSize,
                                Function<T, String> nameOf, Function<T, String> idOf) {
        String normalized = CatalogKeyFactory.getNameSortKey(name);
        List<T> candidates = queryPage(CatalogKeyFactory.gsi3Index(listPartition, normalized), pageSize, null)
            .getResults();

        for (T candidate : candidates) {
            if (excludeId != null && excludeId.equals(idOf.apply(candidate))) {
                continue;
            }
            String candidateName = nameOf.apply(candidate);
            if (candidateName != null && CatalogKeyFactory.getNameSortKey(candidateName).equals(normalized)) {
                return true;
            }
        }
        return false;
    }
}

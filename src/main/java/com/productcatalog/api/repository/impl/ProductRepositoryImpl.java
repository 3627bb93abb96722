package com.productcatalog.api.repository.impl;

import com.productcatalog.api.dto.UpdateProductRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.model.Product;
import com.productcatalog.api.repository.CatalogTableClient;
import com.productcatalog.api.repository.ProductRepository;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.ItemKey;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.UpdateStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Product storage over the detail item and its list projection.
 *
 * The two items are written with separate calls. A failure between them leaves the list
 * projection stale or missing; there is no repair step.
 */
@Repository
public class ProductRepositoryImpl extends CatalogItemRepositorySupport<Product> implements ProductRepository {

    private static final Logger logger = LoggerFactory.getLogger(ProductRepositoryImpl.class);

    // Attributes copied from a detail update onto the list projection. GSI3PK is never one of them.
    static final List<String> MIRRORED_ATTRIBUTES = List.of(
        "name", "brand_id", "category_id", "price", "stock_quantity", "description", "images", "updated_at");

    @Autowired
    public ProductRepositoryImpl(CatalogTableClient tableClient) {
        super(tableClient, Product.class, CatalogKeyFactory.PRODUCT_PREFIX);
    }

    @Override
    public Product create(Product product) {
        putNew(product);
        putNew(product.toListProjection());
        logger.info("Created product {} ({}) in category {}", product.getId(), product.getName(),
            product.getCategoryId());
        return product;
    }

    @Override
    public Optional<Product> findById(String productId) {
        return findByKey(keyOf(productId));
    }

    @Override
    public boolean exists(String productId) {
        return tableClient.exists(keyOf(productId));
    }

    @Override
    public Product update(String productId, UpdateProductRequest changes) {
        UpdateStatement detail = newUpdate(Instant.now());
        if (changes.getName() != null) {
            detail.set("name", changes.getName());
        }
        if (changes.getBrandId() != null) {
            detail.set(CatalogKeyFactory.GSI2_PK, changes.getBrandId());
        }
        if (changes.getCategoryId() != null) {
            detail.set("category_id", changes.getCategoryId());
            detail.set(CatalogKeyFactory.GSI3_PK, CatalogKeyFactory.getCategoryProductsPartition(changes.getCategoryId()));
        }
        if (changes.getPrice() != null) {
            detail.set("price", changes.getPrice());
        }
        if (changes.getStockQuantity() != null) {
            detail.set("stock_quantity", changes.getStockQuantity().intValueExact());
        }
        if (changes.getDescription() != null) {
            if (changes.getDescription().isEmpty()) {
                detail.remove("description");
            } else {
                detail.set("description", changes.getDescription());
            }
        }
        if (changes.getImages() != null) {
            detail.set("images", changes.getImages());
        }

        Product updated;
        try {
            updated = updateExisting(keyOf(productId), detail);
        } catch (NotFoundException e) {
            throw new NotFoundException("Product with ID '" + productId + "' not found", e);
        }

        UpdateStatement listUpdate = detail.copyOf(MIRRORED_ATTRIBUTES);
        if (changes.getName() != null) {
            listUpdate.set(CatalogKeyFactory.GSI3_SK, CatalogKeyFactory.getNameSortKey(changes.getName()));
        }
        tableClient.update(listKeyOf(productId), listUpdate, null);

        logger.info("Updated product {}", productId);
        return updated;
    }

    @Override
    public boolean delete(String productId) {
        if (!exists(productId)) {
            return false;
        }
        tableClient.batchWrite(List.of(), List.of(keyOf(productId), listKeyOf(productId)));
        logger.info("Deleted product {} and its list entry", productId);
        return true;
    }

    @Override
    public PaginatedResult<Product> findAll(int limit, String continuationToken) {
        return queryPage(CatalogKeyFactory.gsi3Index(CatalogKeyFactory.PRODUCT_LIST), limit, continuationToken);
    }

    @Override
    public PaginatedResult<Product> findByBrand(String brandId, int limit, String continuationToken) {
        return queryPage(CatalogKeyFactory.productsByBrandIndex(brandId), limit, continuationToken);
    }

    @Override
    public PaginatedResult<Product> findByCategory(String categoryId, int limit, String continuationToken) {
        return queryPage(CatalogKeyFactory.gsi3Index(CatalogKeyFactory.getCategoryProductsPartition(categoryId)),
            limit, continuationToken);
    }

    private static ItemKey listKeyOf(String productId) {
        return ItemKey.of(CatalogKeyFactory.getProductListPk(productId), CatalogKeyFactory.getProductListSk(productId));
    }
}

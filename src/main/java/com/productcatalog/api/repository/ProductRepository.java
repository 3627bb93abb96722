package com.productcatalog.api.repository;

import com.productcatalog.api.dto.UpdateProductRequest;
import com.productcatalog.api.model.Product;
import com.productcatalog.api.util.PaginatedResult;

import java.util.Optional;

/**
 * Repository for products. Each product is a detail item plus a list projection item;
 * writes touch both, one after the other.
 */
public interface ProductRepository {

    /**
     * Write the detail item and then its list projection.
     */
    Product create(Product product);

    Optional<Product> findById(String productId);

    boolean exists(String productId);

    /**
     * Update the detail item and mirror the shared fields onto the list projection.
     * Null fields are untouched, an empty description is removed from both items.
     */
    Product update(String productId, UpdateProductRequest changes);

    /**
     * Delete the detail item and its list projection.
     *
     * @return false if there was no such product
     */
    boolean delete(String productId);

    /**
     * All products in name order, read from the list projections.
     */
    PaginatedResult<Product> findAll(int limit, String continuationToken);

    PaginatedResult<Product> findByBrand(String brandId, int limit, String continuationToken);

    PaginatedResult<Product> findByCategory(String categoryId, int limit, String continuationToken);
}

package com.productcatalog.api.repository;

import com.productcatalog.api.dto.UpdateCategoryRequest;
import com.productcatalog.api.model.Category;
import com.productcatalog.api.util.PaginatedResult;

import java.util.Optional;

/**
 * Repository for category items and the name-sorted CATEGORY_LIST partition of GSI-3.
 */
public interface CategoryRepository {

    Category create(Category category);

    Optional<Category> findById(String categoryId);

    boolean exists(String categoryId);

    Category update(String categoryId, UpdateCategoryRequest changes);

    boolean delete(String categoryId);

    PaginatedResult<Category> findAll(int limit, String continuationToken);

    boolean existsByName(String name, String excludeCategoryId);
}

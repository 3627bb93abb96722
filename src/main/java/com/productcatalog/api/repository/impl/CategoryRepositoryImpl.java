package com.productcatalog.api.repository.impl;

import com.productcatalog.api.config.CatalogProperties;
import com.productcatalog.api.dto.UpdateCategoryRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.model.Category;
import com.productcatalog.api.repository.CategoryRepository;
import com.productcatalog.api.repository.CatalogTableClient;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.UpdateStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class CategoryRepositoryImpl extends CatalogItemRepositorySupport<Category> implements CategoryRepository {

    private static final Logger logger = LoggerFactory.getLogger(CategoryRepositoryImpl.class);

    private final int uniquenessCheckPageSize;

    @Autowired
    public CategoryRepositoryImpl(CatalogTableClient tableClient, CatalogProperties catalogProperties) {
        super(tableClient, Category.class, CatalogKeyFactory.CATEGORY_PREFIX);
        this.uniquenessCheckPageSize = catalogProperties.getUniquenessCheckPageSize();
    }

    @Override
    public Category create(Category category) {
        putNew(category);
        logger.info("Created category {} ({})", category.getId(), category.getName());
        return category;
    }

    @Override
    public Optional<Category> findById(String categoryId) {
        return findByKey(keyOf(categoryId));
    }

    @Override
    public boolean exists(String categoryId) {
        return tableClient.exists(keyOf(categoryId));
    }

    @Override
    public Category update(String categoryId, UpdateCategoryRequest changes) {
        UpdateStatement update = newUpdate(Instant.now());
        if (changes.getName() != null) {
            update.set("name", changes.getName());
            update.set(CatalogKeyFactory.GSI3_SK, CatalogKeyFactory.getNameSortKey(changes.getName()));
        }
        if (changes.getDescription() != null) {
            update.set("description", changes.getDescription());
        }

        try {
            Category updated = updateExisting(keyOf(categoryId), update);
            logger.info("Updated category {}", categoryId);
            return updated;
        } catch (NotFoundException e) {
            throw new NotFoundException("Category with ID '" + categoryId + "' not found", e);
        }
    }

    @Override
    public boolean delete(String categoryId) {
        if (!exists(categoryId)) {
            return false;
        }
        tableClient.delete(keyOf(categoryId), null);
        logger.info("Deleted category {}", categoryId);
        return true;
    }

    @Override
    public PaginatedResult<Category> findAll(int limit, String continuationToken) {
        return queryPage(CatalogKeyFactory.gsi3Index(CatalogKeyFactory.CATEGORY_LIST), limit, continuationToken);
    }

    @Override
    public boolean existsByName(String name, String excludeCategoryId) {
        return nameTaken(CatalogKeyFactory.CATEGORY_LIST, name, excludeCategoryId, uniquenessCheckPageSize,
            Category::getName, Category::getId);
    }
}

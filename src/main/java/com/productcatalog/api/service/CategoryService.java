package com.productcatalog.api.service;

import com.productcatalog.api.dto.CategoryDto;
import com.productcatalog.api.dto.CreateCategoryRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateCategoryRequest;

/**
 * Service interface for category operations.
 */
public interface CategoryService {

    CategoryDto createCategory(CreateCategoryRequest request);

    CategoryDto getCategory(String categoryId);

    CategoryDto updateCategory(String categoryId, UpdateCategoryRequest request);

    boolean deleteCategory(String categoryId);

    boolean categoryExists(String categoryId);

    PageResponse<CategoryDto> listCategories(Integer limit, String continuationToken);
}

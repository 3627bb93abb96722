package com.productcatalog.api.service.impl;

import com.productcatalog.api.dto.CategoryDto;
import com.productcatalog.api.dto.CreateCategoryRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateCategoryRequest;
import com.productcatalog.api.exception.DuplicateException;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.exception.ValidationException;
import com.productcatalog.api.model.Category;
import com.productcatalog.api.repository.CategoryRepository;
import com.productcatalog.api.service.CategoryService;
import com.productcatalog.api.validation.CategoryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class CategoryServiceImpl implements CategoryService {

    private static final Logger logger = LoggerFactory.getLogger(CategoryServiceImpl.class);

    private final CategoryRepository categoryRepository;
    private final CategoryValidator categoryValidator;
    private final PageSizePolicy pageSizePolicy;

    @Autowired
    public CategoryServiceImpl(CategoryRepository categoryRepository, CategoryValidator categoryValidator,
                               PageSizePolicy pageSizePolicy) {
        this.categoryRepository = categoryRepository;
        this.categoryValidator = categoryValidator;
        this.pageSizePolicy = pageSizePolicy;
    }

    @Override
    public CategoryDto createCategory(CreateCategoryRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        String name = categoryValidator.validateName(request.getName());
        String description = categoryValidator.validateDescription(request.getDescription());

        if (categoryRepository.existsByName(name, null)) {
            throw new DuplicateException("Category name '" + name + "' already exists");
        }

        return CategoryDto.from(categoryRepository.create(new Category(name, description)));
    }

    @Override
    public CategoryDto getCategory(String categoryId) {
        return categoryRepository.findById(categoryId)
            .map(CategoryDto::from)
            .orElseThrow(() -> new NotFoundException("Category not found"));
    }

    @Override
    public CategoryDto updateCategory(String categoryId, UpdateCategoryRequest request) {
        UpdateFieldChecks.requireValidFields(request);

        if (!categoryRepository.exists(categoryId)) {
            throw new NotFoundException("Category with ID '" + categoryId + "' not found");
        }

        UpdateCategoryRequest changes = new UpdateCategoryRequest();
        if (request.isSupplied("name")) {
            String name = categoryValidator.validateName(request.getName());
            if (categoryRepository.existsByName(name, categoryId)) {
                throw new DuplicateException("Category name '" + name + "' already exists");
            }
            changes.setName(name);
        }
        if (request.isSupplied("description")) {
            changes.setDescription(categoryValidator.validateDescription(request.getDescription()));
        }

        return CategoryDto.from(categoryRepository.update(categoryId, changes));
    }

    @Override
    public boolean deleteCategory(String categoryId) {
        boolean deleted = categoryRepository.delete(categoryId);
        if (!deleted) {
            logger.debug("Category {} not found for delete", categoryId);
        }
        return deleted;
    }

    @Override
    public boolean categoryExists(String categoryId) {
        return categoryRepository.exists(categoryId);
    }

    @Override
    public PageResponse<CategoryDto> listCategories(Integer limit, String continuationToken) {
        int pageSize = pageSizePolicy.resolve(limit);
        return PageResponse.from(categoryRepository.findAll(pageSize, continuationToken), CategoryDto::from);
    }
}

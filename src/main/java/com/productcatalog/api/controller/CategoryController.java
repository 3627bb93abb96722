package com.productcatalog.api.controller;

import com.productcatalog.api.dto.ApiResponse;
import com.productcatalog.api.dto.CategoryDto;
import com.productcatalog.api.dto.CreateCategoryRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateCategoryRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.service.CategoryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for categories.
 */
@RestController
@RequestMapping("/categories")
@Validated
public class CategoryController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(CategoryController.class);

    private final CategoryService categoryService;

    @Autowired
    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    /**
     * List categories in name order.
     * GET /categories?limit={limit}&last_key={token}
     */
    @GetMapping
    public ResponseEntity<ApiResponse<PageResponse<CategoryDto>>> listCategories(
            @RequestParam(required = false) @Min(value = 1, message = "Limit must be at least 1") Integer limit,
            @RequestParam(name = "last_key", required = false) String lastKey) {

        PageResponse<CategoryDto> page = categoryService.listCategories(limit, lastKey);
        logger.debug("Listed {} categories", page.getItems().size());
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    @GetMapping("/{categoryId}")
    public ResponseEntity<ApiResponse<CategoryDto>> getCategory(@PathVariable String categoryId) {
        return ResponseEntity.ok(ApiResponse.success(categoryService.getCategory(categoryId)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<CategoryDto>> createCategory(@Valid @RequestBody CreateCategoryRequest request) {
        CategoryDto category = categoryService.createCategory(request);
        logger.info("Category {} created", category.getId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.of("Category created successfully", category));
    }

    @PutMapping("/{categoryId}")
    public ResponseEntity<ApiResponse<CategoryDto>> updateCategory(@PathVariable String categoryId,
                                                                   @Valid @RequestBody UpdateCategoryRequest request) {
        CategoryDto category = categoryService.updateCategory(categoryId, request);
        return ResponseEntity.ok(ApiResponse.of("Category updated successfully", category));
    }

    @DeleteMapping("/{categoryId}")
    public ResponseEntity<ApiResponse<Void>> deleteCategory(@PathVariable String categoryId) {
        if (!categoryService.deleteCategory(categoryId)) {
            throw new NotFoundException("Category not found");
        }
        return ResponseEntity.ok(ApiResponse.message("Category deleted successfully"));
    }
}

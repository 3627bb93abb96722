package com.productcatalog.api.controller;

import com.productcatalog.api.dto.ApiResponse;
import com.productcatalog.api.dto.CreateProductRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.ProductDto;
import com.productcatalog.api.dto.StockUpdateRequest;
import com.productcatalog.api.dto.UpdateProductRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.exception.ValidationException;
import com.productcatalog.api.service.ProductService;
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
 * REST controller for products.
 * Besides CRUD it serves the brand and category listings and stock changes:
 * GET /products/by-brand/{brandId}, GET /products/by-category/{categoryId},
 * PATCH /products/{productId}/stock.
 */
@RestController
@RequestMapping("/products")
@Validated
public class ProductController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(ProductController.class);

    private final ProductService productService;

    @Autowired
    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PageResponse<ProductDto>>> listProducts(
            @RequestParam(required = false) @Min(value = 1, message = "Limit must be at least 1") Integer limit,
            @RequestParam(name = "last_key", required = false) String lastKey) {

        return ResponseEntity.ok(ApiResponse.success(productService.listProducts(limit, lastKey)));
    }

    @GetMapping("/by-brand/{brandId}")
    public ResponseEntity<ApiResponse<PageResponse<ProductDto>>> listProductsByBrand(
            @PathVariable String brandId,
            @RequestParam(required = false) @Min(value = 1, message = "Limit must be at least 1") Integer limit,
            @RequestParam(name = "last_key", required = false) String lastKey) {

        PageResponse<ProductDto> page = productService.listProductsByBrand(brandId, limit, lastKey);
        logger.debug("Listed {} products for brand {}", page.getItems().size(), brandId);
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    @GetMapping("/by-category/{categoryId}")
    public ResponseEntity<ApiResponse<PageResponse<ProductDto>>> listProductsByCategory(
            @PathVariable String categoryId,
            @RequestParam(required = false) @Min(value = 1, message = "Limit must be at least 1") Integer limit,
            @RequestParam(name = "last_key", required = false) String lastKey) {

        PageResponse<ProductDto> page = productService.listProductsByCategory(categoryId, limit, lastKey);
        logger.debug("Listed {} products for category {}", page.getItems().size(), categoryId);
        return ResponseEntity.ok(ApiResponse.success(page));
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ApiResponse<ProductDto>> getProduct(@PathVariable String productId) {
        return ResponseEntity.ok(ApiResponse.success(productService.getProduct(productId)));
    }

    @PostMapping
    public ResponseEntity<ApiResponse<ProductDto>> createProduct(@Valid @RequestBody CreateProductRequest request) {
        ProductDto product = productService.createProduct(request);
        logger.info("Product {} created", product.getId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(ApiResponse.of("Product created successfully", product));
    }

    @PutMapping("/{productId}")
    public ResponseEntity<ApiResponse<ProductDto>> updateProduct(@PathVariable String productId,
                                                                 @Valid @RequestBody UpdateProductRequest request) {
        ProductDto product = productService.updateProduct(productId, request);
        return ResponseEntity.ok(ApiResponse.of("Product updated successfully", product));
    }

    /**
     * Absolute ({@code stock_quantity}) or relative ({@code quantity_change}) stock update.
     */
    @PatchMapping("/{productId}/stock")
    public ResponseEntity<ApiResponse<ProductDto>> updateStock(@PathVariable String productId,
                                                               @Valid @RequestBody StockUpdateRequest request) {
        if (request.getStockQuantity() != null) {
            ProductDto product = productService.updateStock(productId, request.getStockQuantity());
            return ResponseEntity.ok(ApiResponse.of("Stock updated successfully", product));
        }
        if (request.getQuantityChange() != null) {
            ProductDto product = productService.adjustStock(productId, request.getQuantityChange());
            return ResponseEntity.ok(ApiResponse.of("Stock adjusted successfully", product));
        }
        throw new ValidationException("Either stock_quantity or quantity_change is required");
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<ApiResponse<Void>> deleteProduct(@PathVariable String productId) {
        if (!productService.deleteProduct(productId)) {
            throw new NotFoundException("Product not found");
        }
        return ResponseEntity.ok(ApiResponse.message("Product deleted successfully"));
    }
}

package com.productcatalog.api.service;

import com.productcatalog.api.dto.CreateProductRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.ProductDto;
import com.productcatalog.api.dto.UpdateProductRequest;

import java.math.BigDecimal;

/**
 * Service interface for product operations, including stock management.
 */
public interface ProductService {

    /**
     * Validate and store a new product. The referenced brand and category must exist.
     */
    ProductDto createProduct(CreateProductRequest request);

    ProductDto getProduct(String productId);

    ProductDto updateProduct(String productId, UpdateProductRequest request);

    boolean deleteProduct(String productId);

    PageResponse<ProductDto> listProducts(Integer limit, String continuationToken);

    PageResponse<ProductDto> listProductsByBrand(String brandId, Integer limit, String continuationToken);

    PageResponse<ProductDto> listProductsByCategory(String categoryId, Integer limit, String continuationToken);

    /**
     * Set the stock level to an absolute value.
     */
    ProductDto updateStock(String productId, BigDecimal stockQuantity);

    /**
     * Add a signed amount to the current stock level.
     *
     * @throws com.productcatalog.api.exception.ValidationException if the result would be negative
     */
    ProductDto adjustStock(String productId, BigDecimal quantityChange);
}

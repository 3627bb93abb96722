package com.productcatalog.api.service.impl;

import com.productcatalog.api.dto.CreateProductRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.ProductDto;
import com.productcatalog.api.dto.UpdateProductRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.exception.ValidationException;
import com.productcatalog.api.model.Product;
import com.productcatalog.api.repository.BrandRepository;
import com.productcatalog.api.repository.CategoryRepository;
import com.productcatalog.api.repository.ProductRepository;
import com.productcatalog.api.service.ProductService;
import com.productcatalog.api.validation.ProductValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Collections;

/**
 * Product operations, including the brand and category existence checks and stock changes.
 */
@Service
public class ProductServiceImpl implements ProductService {

    private static final Logger logger = LoggerFactory.getLogger(ProductServiceImpl.class);

    private final ProductRepository productRepository;
    private final BrandRepository brandRepository;
    private final CategoryRepository categoryRepository;
    private final ProductValidator productValidator;
    private final PageSizePolicy pageSizePolicy;

    @Autowired
    public ProductServiceImpl(ProductRepository productRepository, BrandRepository brandRepository,
                              CategoryRepository categoryRepository, ProductValidator productValidator,
                              PageSizePolicy pageSizePolicy) {
        this.productRepository = productRepository;
        this.brandRepository = brandRepository;
        this.categoryRepository = categoryRepository;
        this.productValidator = productValidator;
        this.pageSizePolicy = pageSizePolicy;
    }

    @Override
    public ProductDto createProduct(CreateProductRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        String name = productValidator.validateName(request.getName());
        String brandId = productValidator.validateBrandId(request.getBrandId());
        String categoryId = productValidator.validateCategoryId(request.getCategoryId());
        if (request.getPrice() == null) {
            throw new ValidationException("Price is required");
        }
        String description = productValidator.validateDescription(request.getDescription());
        int stockQuantity = request.getStockQuantity() == null
            ? 0 : productValidator.validateStockQuantity(request.getStockQuantity());

        requireBrand(brandId);
        requireCategory(categoryId);

        Product product = new Product(name, brandId, categoryId, request.getPrice(), stockQuantity, description,
            request.getImages());
        return ProductDto.from(productRepository.create(product));
    }

    @Override
    public ProductDto getProduct(String productId) {
        return productRepository.findById(productId)
            .map(ProductDto::from)
            .orElseThrow(() -> new NotFoundException("Product not found"));
    }

    @Override
    public ProductDto updateProduct(String productId, UpdateProductRequest request) {
        UpdateFieldChecks.requireValidFields(request);

        if (!productRepository.exists(productId)) {
            throw new NotFoundException("Product with ID '" + productId + "' not found");
        }

        UpdateProductRequest changes = new UpdateProductRequest();
        if (request.isSupplied("name")) {
            changes.setName(productValidator.validateName(request.getName()));
        }
        if (request.isSupplied("brandId")) {
            String brandId = productValidator.validateBrandId(request.getBrandId());
            requireBrand(brandId);
            changes.setBrandId(brandId);
        }
        if (request.isSupplied("categoryId")) {
            String categoryId = productValidator.validateCategoryId(request.getCategoryId());
            requireCategory(categoryId);
            changes.setCategoryId(categoryId);
        }
        if (request.isSupplied("price")) {
            if (request.getPrice() == null) {
                throw new ValidationException("Price is required");
            }
            changes.setPrice(request.getPrice());
        }
        if (request.isSupplied("stockQuantity")) {
            changes.setStockQuantity(BigDecimal.valueOf(productValidator.validateStockQuantity(request.getStockQuantity())));
        }
        if (request.isSupplied("description")) {
            String description = productValidator.validateDescription(request.getDescription());
            changes.setDescription(description == null ? "" : description);
        }
        if (request.isSupplied("images")) {
            changes.setImages(request.getImages() == null ? Collections.emptyList() : request.getImages());
        }

        return ProductDto.from(productRepository.update(productId, changes));
    }

    @Override
    public boolean deleteProduct(String productId) {
        boolean deleted = productRepository.delete(productId);
        if (!deleted) {
            logger.debug("Product {} not found for delete", productId);
        }
        return deleted;
    }

    @Override
    public PageResponse<ProductDto> listProducts(Integer limit, String continuationToken) {
        int pageSize = pageSizePolicy.resolve(limit);
        return PageResponse.from(productRepository.findAll(pageSize, continuationToken), ProductDto::from);
    }

    @Override
    public PageResponse<ProductDto> listProductsByBrand(String brandId, Integer limit, String continuationToken) {
        int pageSize = pageSizePolicy.resolve(limit);
        return PageResponse.from(productRepository.findByBrand(brandId, pageSize, continuationToken), ProductDto::from);
    }

    @Override
    public PageResponse<ProductDto> listProductsByCategory(String categoryId, Integer limit, String continuationToken) {
        int pageSize = pageSizePolicy.resolve(limit);
        return PageResponse.from(productRepository.findByCategory(categoryId, pageSize, continuationToken),
            ProductDto::from);
    }

    @Override
    public ProductDto updateStock(String productId, BigDecimal stockQuantity) {
        int validated = productValidator.validateStockQuantity(stockQuantity);
        if (!productRepository.exists(productId)) {
            throw new NotFoundException("Product with ID '" + productId + "' not found");
        }
        return ProductDto.from(productRepository.update(productId, stockChange(validated)));
    }

    @Override
    public ProductDto adjustStock(String productId, BigDecimal quantityChange) {
        if (quantityChange == null) {
            throw new ValidationException("quantity_change is required");
        }

        Product product = productRepository.findById(productId)
            .orElseThrow(() -> new NotFoundException("Product with ID '" + productId + "' not found"));

        int currentStock = product.getStockQuantity() == null ? 0 : product.getStockQuantity();
        BigDecimal newStock = BigDecimal.valueOf(currentStock).add(quantityChange);
        if (newStock.signum() < 0) {
            throw new ValidationException("Stock quantity cannot be negative after adjustment");
        }

        int validated = productValidator.validateStockQuantity(newStock);
        logger.debug("Adjusting stock of product {} from {} to {}", productId, currentStock, validated);
        return ProductDto.from(productRepository.update(productId, stockChange(validated)));
    }

    private static UpdateProductRequest stockChange(int stockQuantity) {
        UpdateProductRequest changes = new UpdateProductRequest();
        changes.setStockQuantity(BigDecimal.valueOf(stockQuantity));
        return changes;
    }

    private void requireBrand(String brandId) {
        if (!brandRepository.exists(brandId)) {
            throw new NotFoundException("Brand with ID '" + brandId + "' not found");
        }
    }

    private void requireCategory(String categoryId) {
        if (!categoryRepository.exists(categoryId)) {
            throw new NotFoundException("Category with ID '" + categoryId + "' not found");
        }
    }
}

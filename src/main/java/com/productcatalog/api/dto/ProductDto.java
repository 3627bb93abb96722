package com.productcatalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.productcatalog.api.model.Product;
import com.productcatalog.api.util.AttributeValueConverter;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Product as returned by the API. The same shape is used for detail reads and for
 * list pages built from the list projection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProductDto {

    private String id;
    private String name;
    private String brandId;
    private String categoryId;
    private Number price; // 20 rather than 20.00
    private Integer stockQuantity;
    private String description;
    private List<String> images;
    private String createdAt;
    private String updatedAt;

    public static ProductDto from(Product product) {
        return ProductDto.builder()
            .id(product.getId())
            .name(product.getName())
            .brandId(product.getBrandId())
            .categoryId(product.getCategoryId())
            .price(AttributeValueConverter.normalizeNumber(product.getPrice()))
            .stockQuantity(product.getStockQuantity())
            .description(product.getDescription())
            .images(product.getImages())
            .createdAt(product.getCreatedAt() != null ? product.getCreatedAt().toString() : null)
            .updatedAt(product.getUpdatedAt() != null ? product.getUpdatedAt().toString() : null)
            .build();
    }
}

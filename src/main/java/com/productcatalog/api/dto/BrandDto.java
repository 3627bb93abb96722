package com.productcatalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.productcatalog.api.model.Brand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Brand as returned by the API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BrandDto {

    private String id;
    private String name;
    private String description;
    private String website;
    private String createdAt;
    private String updatedAt;

    public static BrandDto from(Brand brand) {
        return BrandDto.builder()
            .id(brand.getId())
            .name(brand.getName())
            .description(brand.getDescription())
            .website(brand.getWebsite())
            .createdAt(brand.getCreatedAt() != null ? brand.getCreatedAt().toString() : null)
            .updatedAt(brand.getUpdatedAt() != null ? brand.getUpdatedAt().toString() : null)
            .build();
    }
}

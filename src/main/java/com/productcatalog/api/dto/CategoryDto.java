package com.productcatalog.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.productcatalog.api.model.Category;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CategoryDto {

    private String id;
    private String name;
    private String description;
    private String createdAt;
    private String updatedAt;

    public static CategoryDto from(Category category) {
        return CategoryDto.builder()
            .id(category.getId())
            .name(category.getName())
            .description(category.getDescription())
            .createdAt(category.getCreatedAt() != null ? category.getCreatedAt().toString() : null)
            .updatedAt(category.getUpdatedAt() != null ? category.getUpdatedAt().toString() : null)
            .build();
    }
}

package com.productcatalog.api.dto;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * Request DTO for updating a category. Absent fields are left unchanged.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class UpdateCategoryRequest extends PartialUpdateRequest {

    private String name;

    private String description;

    public void setName(String name) {
        this.name = name;
        markSupplied("name");
    }

    public void setDescription(String description) {
        this.description = description;
        markSupplied("description");
    }
}

package com.productcatalog.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for updating a product. Absent fields are left unchanged;
 * an empty or null description removes the stored description.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UpdateProductRequest extends PartialUpdateRequest {

    private String name;

    @Pattern(regexp = RequestFieldRules.UUID, message = "Brand ID must be a valid UUID")
    private String brandId;

    @Pattern(regexp = RequestFieldRules.UUID, message = "Category ID must be a valid UUID")
    private String categoryId;

    @DecimalMin(value = "0", message = "Price cannot be negative")
    @DecimalMax(value = "999999.99", message = "Price cannot exceed 999,999.99")
    @Digits(integer = 12, fraction = 2, message = "Price cannot have more than 2 decimal places")
    private BigDecimal price;

    @Min(value = 0, message = "Stock quantity cannot be negative")
    @Max(value = 999_999, message = "Stock quantity cannot exceed 999,999")
    @Digits(integer = 12, fraction = 0, message = "Stock quantity must be a whole number")
    private BigDecimal stockQuantity;

    private String description;

    @Size(max = 10, message = "Cannot have more than 10 images")
    private List<@NotNull(message = "Image URL cannot be empty")
        @Pattern(regexp = RequestFieldRules.IMAGE_URL,
            message = "Images must be valid image URLs (jpg, jpeg, png, gif, webp)") String> images;

    public void setName(String name) {
        this.name = name;
        markSupplied("name");
    }

    public void setBrandId(String brandId) {
        this.brandId = brandId;
        markSupplied("brandId");
    }

    public void setCategoryId(String categoryId) {
        this.categoryId = categoryId;
        markSupplied("categoryId");
    }

    public void setPrice(BigDecimal price) {
        this.price = RequestFieldRules.stripZeros(price);
        markSupplied("price");
    }

    public void setStockQuantity(BigDecimal stockQuantity) {
        this.stockQuantity = RequestFieldRules.stripZeros(stockQuantity);
        markSupplied("stockQuantity");
    }

    public void setDescription(String description) {
        this.description = description;
        markSupplied("description");
    }

    public void setImages(List<String> images) {
        this.images = images;
        markSupplied("images");
    }
}

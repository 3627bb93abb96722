package com.productcatalog.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Request DTO for creating a new product.
 * Numbers are read as BigDecimal so fractional stock values can be rejected instead of truncated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CreateProductRequest {

    private String name;

    @NotBlank(message = "Brand ID is required")
    @Pattern(regexp = RequestFieldRules.UUID, message = "Brand ID must be a valid UUID")
    private String brandId;

    @NotBlank(message = "Category ID is required")
    @Pattern(regexp = RequestFieldRules.UUID, message = "Category ID must be a valid UUID")
    private String categoryId;

    @NotNull(message = "Price is required")
    @DecimalMin(value = "0", message = "Price cannot be negative")
    @DecimalMax(value = "999999.99", message = "Price cannot exceed 999,999.99")
    @Digits(integer = 12, fraction = 2, message = "Price cannot have more than 2 decimal places")
    private BigDecimal price;

    @Min(value = 0, message = "Stock quantity cannot be negative")
    @Max(value = 999_999, message = "Stock quantity cannot exceed 999,999")
    @Digits(integer = 12, fraction = 0, message = "Stock quantity must be a whole number")
    private BigDecimal stockQuantity; // Defaults to 0

    private String description; // Optional

    @Size(max = 10, message = "Cannot have more than 10 images")
    private List<@NotNull(message = "Image URL cannot be empty")
        @Pattern(regexp = RequestFieldRules.IMAGE_URL,
            message = "Images must be valid image URLs (jpg, jpeg, png, gif, webp)") String> images; // Optional

    public void setPrice(BigDecimal price) {
        this.price = RequestFieldRules.stripZeros(price);
    }

    public void setStockQuantity(BigDecimal stockQuantity) {
        this.stockQuantity = RequestFieldRules.stripZeros(stockQuantity);
    }
}

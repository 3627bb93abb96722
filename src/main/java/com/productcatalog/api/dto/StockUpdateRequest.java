package com.productcatalog.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Body of PATCH /products/{id}/stock: either an absolute {@code stock_quantity}
 * or a relative {@code quantity_change}. The absolute value wins when both are sent.
 */
@Data
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StockUpdateRequest {

    @Min(value = 0, message = "Stock quantity cannot be negative")
    @Max(value = 999_999, message = "Stock quantity cannot exceed 999,999")
    @Digits(integer = 12, fraction = 0, message = "Stock quantity must be a whole number")
    private BigDecimal stockQuantity;

    @Digits(integer = 12, fraction = 0, message = "quantity_change must be an integer")
    private BigDecimal quantityChange;

    public void setStockQuantity(BigDecimal stockQuantity) {
        this.stockQuantity = RequestFieldRules.stripZeros(stockQuantity);
    }

    public void setQuantityChange(BigDecimal quantityChange) {
        this.quantityChange = RequestFieldRules.stripZeros(quantityChange);
    }
}

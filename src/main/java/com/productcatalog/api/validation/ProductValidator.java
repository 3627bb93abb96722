package com.productcatalog.api.validation;

import com.productcatalog.api.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.regex.Pattern;

/**
 * Product rules that need trimming or a computed value. Format rules for ids, prices
 * and images live on the request DTOs.
 */
@Component
public class ProductValidator extends NamedEntityValidator {

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9\\s\\-_&.,()'\"/!+]+$");

    static final int MAX_NAME_LENGTH = 200;
    static final int MAX_DESCRIPTION_LENGTH = 1000;
    static final int MAX_STOCK = 999_999;

    public ProductValidator() {
        super("Product", MAX_NAME_LENGTH, NAME_PATTERN);
    }

    public String validateBrandId(String brandId) {
        return validateReferenceId(brandId, "Brand ID");
    }

    public String validateCategoryId(String categoryId) {
        return validateReferenceId(categoryId, "Category ID");
    }

    private String validateReferenceId(String id, String label) {
        if (id == null) {
            throw new ValidationException(label + " is required");
        }
        String trimmed = id.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(label + " cannot be empty or whitespace");
        }
        return trimmed;
    }

    /**
     * @return the trimmed description, or null when none was given
     */
    public String validateDescription(String description) {
        return validateOptionalDescription(description, MAX_DESCRIPTION_LENGTH);
    }

    /**
     * Checks a stock level that is about to be stored, including levels computed from an adjustment.
     */
    public int validateStockQuantity(BigDecimal stockQuantity) {
        if (stockQuantity == null) {
            throw new ValidationException("Stock quantity is required");
        }
        if (stockQuantity.stripTrailingZeros().scale() > 0) {
            throw new ValidationException("Stock quantity must be a whole number");
        }
        if (stockQuantity.signum() < 0) {
            throw new ValidationException("Stock quantity cannot be negative");
        }
        if (stockQuantity.compareTo(BigDecimal.valueOf(MAX_STOCK)) > 0) {
            throw new ValidationException("Stock quantity cannot exceed 999,999");
        }
        return stockQuantity.intValueExact();
    }
}

package com.productcatalog.api.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.*;

class StockUpdateRequestTest {

    private Validator validator;

    @BeforeEach
    void setUp() {
        validator = Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Test
    void validation_WithNegativeChange_PassesValidation() {
        StockUpdateRequest request = new StockUpdateRequest();
        request.setQuantityChange(BigDecimal.valueOf(-5));

        assertThat(validator.validate(request)).isEmpty();
    }

    @Test
    void validation_WithFractionalChange_FailsValidation() {
        StockUpdateRequest request = new StockUpdateRequest();
        request.setQuantityChange(new BigDecimal("1.5"));

        assertThat(validator.validate(request)).extracting(ConstraintViolation::getMessage)
            .containsExactly("quantity_change must be an integer");
    }

    @Test
    void validation_WithAbsoluteStockOutOfRange_FailsValidation() {
        StockUpdateRequest request = new StockUpdateRequest();
        request.setStockQuantity(BigDecimal.valueOf(-1));

        assertThat(validator.validate(request)).extracting(ConstraintViolation::getMessage)
            .containsExactly("Stock quantity cannot be negative");
    }
}

package com.productcatalog.api.dto;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CreateProductRequest validation.
 */
class CreateProductRequestTest {

    private static final String BRAND_ID = "12345678-1234-1234-1234-123456789abc";
    private static final String CATEGORY_ID = "87654321-4321-4321-4321-cba987654321";

    private Validator validator;

    @BeforeEach
    void setUp() {
        ValidatorFactory factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    private CreateProductRequest validRequest() {
        CreateProductRequest request = new CreateProductRequest();
        request.setName("Widget");
        request.setBrandId(BRAND_ID);
        request.setCategoryId(CATEGORY_ID);
        request.setPrice(new BigDecimal("19.99"));
        request.setStockQuantity(BigDecimal.TEN);
        return request;
    }

    private List<String> messages(CreateProductRequest request) {
        List<String> messages = new ArrayList<>();
        for (ConstraintViolation<CreateProductRequest> violation : validator.validate(request)) {
            messages.add(violation.getMessage());
        }
        return messages;
    }

    @Test
    void validation_WithValidData_PassesValidation() {
        assertThat(validator.validate(validRequest())).isEmpty();
    }

    @Test
    void validation_WithNonUuidBrandId_FailsValidation() {
        // Given
        CreateProductRequest request = validRequest();
        request.setBrandId("not-a-uuid");

        // When
        Set<ConstraintViolation<CreateProductRequest>> violations = validator.validate(request);

        // Then
        assertThat(violations).hasSize(1);
        ConstraintViolation<CreateProductRequest> violation = violations.iterator().next();
        assertThat(violation.getPropertyPath().toString()).isEqualTo("brandId");
        assertThat(violation.getMessage()).isEqualTo("Brand ID must be a valid UUID");
    }

    @Test
    void validation_WithMissingCategoryId_FailsValidation() {
        CreateProductRequest request = validRequest();
        request.setCategoryId(null);

        assertThat(messages(request)).containsExactly("Category ID is required");
    }

    @Nested
    class Price {

        @Test
        void validation_PriceBoundaries_Pass() {
            CreateProductRequest request = validRequest();

            request.setPrice(BigDecimal.ZERO);
            assertThat(validator.validate(request)).isEmpty();

            request.setPrice(new BigDecimal("999999.99"));
            assertThat(validator.validate(request)).isEmpty();

            request.setPrice(new BigDecimal("10.500"));
            assertThat(validator.validate(request)).isEmpty();
        }

        @Test
        void validation_WithMissingPrice_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setPrice(null);

            assertThat(messages(request)).containsExactly("Price is required");
        }

        @Test
        void validation_WithNegativePrice_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setPrice(new BigDecimal("-0.01"));

            assertThat(messages(request)).containsExactly("Price cannot be negative");
        }

        @Test
        void validation_WithPriceAboveMaximum_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setPrice(new BigDecimal("1000000.00"));

            assertThat(messages(request)).containsExactly("Price cannot exceed 999,999.99");
        }

        @Test
        void validation_WithThreeDecimals_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setPrice(new BigDecimal("1.999"));

            assertThat(messages(request)).containsExactly("Price cannot have more than 2 decimal places");
        }
    }

    @Nested
    class Stock {

        @Test
        void validation_WholeStockWithTrailingZeros_Passes() {
            CreateProductRequest request = validRequest();
            request.setStockQuantity(new BigDecimal("5.0"));

            assertThat(validator.validate(request)).isEmpty();
            assertThat(request.getStockQuantity()).isEqualByComparingTo("5");
        }

        @Test
        void validation_WithoutStock_Passes() {
            CreateProductRequest request = validRequest();
            request.setStockQuantity(null);

            assertThat(validator.validate(request)).isEmpty();
        }

        @Test
        void validation_WithFractionalStock_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setStockQuantity(new BigDecimal("1.5"));

            assertThat(messages(request)).containsExactly("Stock quantity must be a whole number");
        }

        @Test
        void validation_WithNegativeStock_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setStockQuantity(BigDecimal.valueOf(-1));

            assertThat(messages(request)).containsExactly("Stock quantity cannot be negative");
        }

        @Test
        void validation_WithStockAboveMaximum_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setStockQuantity(BigDecimal.valueOf(1_000_000));

            assertThat(messages(request)).containsExactly("Stock quantity cannot exceed 999,999");
        }
    }

    @Nested
    class Images {

        @Test
        void validation_WithImageUrls_PassesValidation() {
            CreateProductRequest request = validRequest();
            request.setImages(List.of("https://cdn.example.com/a.PNG", "http://cdn.example.com/b.webp?v=2"));

            assertThat(validator.validate(request)).isEmpty();
        }

        @Test
        void validation_AtMostTenImages() {
            CreateProductRequest request = validRequest();
            List<String> images = new ArrayList<>(Collections.nCopies(10, "https://cdn.example.com/a.jpg"));
            request.setImages(images);
            assertThat(validator.validate(request)).isEmpty();

            images.add("https://cdn.example.com/b.jpg");
            assertThat(messages(request)).containsExactly("Cannot have more than 10 images");
        }

        @Test
        void validation_WithNonImageUrl_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setImages(List.of("https://cdn.example.com/a.jpg", "https://cdn.example.com/a.bmp"));

            assertThat(messages(request))
                .containsExactly("Images must be valid image URLs (jpg, jpeg, png, gif, webp)");
        }

        @Test
        void validation_WithNullImage_FailsValidation() {
            CreateProductRequest request = validRequest();
            request.setImages(Arrays.asList("https://cdn.example.com/a.jpg", null));

            assertThat(messages(request)).containsExactly("Image URL cannot be empty");
        }
    }
}

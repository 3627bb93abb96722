package com.productcatalog.api.exception;

/**
 * Exception thrown when request data fails validation.
 * Covers missing fields, malformed values and out-of-range numbers.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

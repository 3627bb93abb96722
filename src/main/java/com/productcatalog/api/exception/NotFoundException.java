package com.productcatalog.api.exception;

/**
 * Exception thrown when a targeted or referenced catalog entity does not exist.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}

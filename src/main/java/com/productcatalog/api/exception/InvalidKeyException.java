package com.productcatalog.api.exception;

/**
 * Exception thrown when DynamoDB key construction fails.
 * Used by CatalogKeyFactory to reject blank entity ids.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}

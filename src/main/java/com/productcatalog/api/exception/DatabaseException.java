package com.productcatalog.api.exception;

/**
 * Exception thrown when a table operation fails for any reason other than a conditional check.
 * Wraps lower-level DynamoDB exceptions with meaningful messages.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String message) {
        super(message);
    }

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.productcatalog.api.exception;

/**
 * Exception thrown when a name is already taken or a conditional create finds an existing item.
 */
public class DuplicateException extends RuntimeException {

    public DuplicateException(String message) {
        super(message);
    }

    public DuplicateException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.productcatalog.api.service.impl;

import com.productcatalog.api.dto.PartialUpdateRequest;
import com.productcatalog.api.exception.ValidationException;

final class UpdateFieldChecks {

    private UpdateFieldChecks() {
    }

    /**
     * Reject unknown keys first, then requests that change nothing.
     */
    static void requireValidFields(PartialUpdateRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        if (request.hasUnknownFields()) {
            throw new ValidationException("Invalid fields: " + String.join(", ", request.getUnknownFields()));
        }
        if (request.isEmpty()) {
            throw new ValidationException("No valid fields to update");
        }
    }
}

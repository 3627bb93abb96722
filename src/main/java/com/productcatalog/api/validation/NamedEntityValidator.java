package com.productcatalog.api.validation;

import com.productcatalog.api.exception.ValidationException;

import java.util.regex.Pattern;

/**
 * Shared rules for entities with a display name and a free-text description.
 * Every check returns the trimmed value that should be stored.
 */
public abstract class NamedEntityValidator {

    private final String label;
    private final int maxNameLength;
    private final Pattern namePattern;

    protected NamedEntityValidator(String label, int maxNameLength, Pattern namePattern) {
        this.label = label;
        this.maxNameLength = maxNameLength;
        this.namePattern = namePattern;
    }

    public String validateName(String name) {
        if (name == null) {
            throw new ValidationException(label + " name is required");
        }
        String trimmed = name.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(label + " name cannot be empty or whitespace");
        }
        if (trimmed.length() < 2) {
            throw new ValidationException(label + " name must be at least 2 characters long");
        }
        if (trimmed.length() > maxNameLength) {
            throw new ValidationException(label + " name cannot exceed " + maxNameLength + " characters");
        }
        if (!namePattern.matcher(trimmed).matches()) {
            throw new ValidationException(label + " name contains invalid characters");
        }
        return trimmed;
    }

    /**
     * Required description of 10 to {@code maxLength} characters.
     */
    protected String validateRequiredDescription(String description, int maxLength) {
        if (description == null) {
            throw new ValidationException(label + " description is required");
        }
        String trimmed = description.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException(label + " description cannot be empty or whitespace");
        }
        return checkDescriptionLength(trimmed, maxLength);
    }

    /**
     * Optional description; null or blank input means "no description" and yields null.
     */
    protected String validateOptionalDescription(String description, int maxLength) {
        if (description == null || description.trim().isEmpty()) {
            return null;
        }
        return checkDescriptionLength(description.trim(), maxLength);
    }

    private String checkDescriptionLength(String trimmed, int maxLength) {
        if (trimmed.length() < 10) {
            throw new ValidationException(label + " description must be at least 10 characters long");
        }
        if (trimmed.length() > maxLength) {
            throw new ValidationException(label + " description cannot exceed " + maxLength + " characters");
        }
        return trimmed;
    }
}

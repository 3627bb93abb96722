package com.productcatalog.api.validation;

import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class BrandValidator extends NamedEntityValidator {

    static final Pattern NAME_PATTERN = Pattern.compile("^[a-zA-Z0-9\\s\\-_&.]+$");
    static final int MAX_NAME_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    public BrandValidator() {
        super("Brand", MAX_NAME_LENGTH, NAME_PATTERN);
    }

    public String validateDescription(String description) {
        return validateRequiredDescription(description, MAX_DESCRIPTION_LENGTH);
    }
}

package com.productcatalog.api.service.impl;

import com.productcatalog.api.config.CatalogProperties;
import com.productcatalog.api.exception.ValidationException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Turns a caller-supplied page size into the one sent to the store.
 */
@Component
public class PageSizePolicy {

    private final CatalogProperties catalogProperties;

    @Autowired
    public PageSizePolicy(CatalogProperties catalogProperties) {
        this.catalogProperties = catalogProperties;
    }

    public int resolve(Integer requested) {
        if (requested == null) {
            return catalogProperties.getDefaultPageSize();
        }
        if (requested < 1) {
            throw new ValidationException("Limit must be at least 1");
        }
        return Math.min(requested, catalogProperties.getMaxPageSize());
    }
}

package com.productcatalog.api.repository;

import com.productcatalog.api.dto.UpdateBrandRequest;
import com.productcatalog.api.model.Brand;
import com.productcatalog.api.util.PaginatedResult;

import java.util.Optional;

/**
 * Repository for brand items and the name-sorted BRAND_LIST partition of GSI-3.
 */
public interface BrandRepository {

    /**
     * Write a new brand; fails with DuplicateException if its key is already taken.
     */
    Brand create(Brand brand);

    Optional<Brand> findById(String brandId);

    boolean exists(String brandId);

    /**
     * Apply already-validated changes. Null fields are untouched, an empty website is removed.
     * Fails with NotFoundException when the brand does not exist.
     */
    Brand update(String brandId, UpdateBrandRequest changes);

    /**
     * @return false if there was no such brand
     */
    boolean delete(String brandId);

    PaginatedResult<Brand> findAll(int limit, String continuationToken);

    /**
     * Case-insensitive name lookup over the first page of name matches.
     *
     * @param excludeBrandId brand to ignore (the one being renamed), or null
     */
    boolean existsByName(String name, String excludeBrandId);
}

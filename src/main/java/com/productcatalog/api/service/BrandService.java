package com.productcatalog.api.service;

import com.productcatalog.api.dto.BrandDto;
import com.productcatalog.api.dto.CreateBrandRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateBrandRequest;

/**
 * Service interface for brand operations.
 */
public interface BrandService {

    /**
     * Validate and store a new brand with a case-insensitively unique name.
     */
    BrandDto createBrand(CreateBrandRequest request);

    /**
     * @throws com.productcatalog.api.exception.NotFoundException if the brand does not exist
     */
    BrandDto getBrand(String brandId);

    BrandDto updateBrand(String brandId, UpdateBrandRequest request);

    /**
     * @return false if there was no such brand
     */
    boolean deleteBrand(String brandId);

    boolean brandExists(String brandId);

    /**
     * Brands in name order.
     *
     * @param limit page size, null for the default
     */
    PageResponse<BrandDto> listBrands(Integer limit, String continuationToken);
}

package com.productcatalog.api.service.impl;

import com.productcatalog.api.dto.BrandDto;
import com.productcatalog.api.dto.CreateBrandRequest;
import com.productcatalog.api.dto.PageResponse;
import com.productcatalog.api.dto.UpdateBrandRequest;
import com.productcatalog.api.exception.DuplicateException;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.exception.ValidationException;
import com.productcatalog.api.model.Brand;
import com.productcatalog.api.repository.BrandRepository;
import com.productcatalog.api.service.BrandService;
import com.productcatalog.api.validation.BrandValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Brand operations. The name check reads before it writes, so two concurrent requests with
 * the same name can both pass it.
 */
@Service
public class BrandServiceImpl implements BrandService {

    private static final Logger logger = LoggerFactory.getLogger(BrandServiceImpl.class);

    private final BrandRepository brandRepository;
    private final BrandValidator brandValidator;
    private final PageSizePolicy pageSizePolicy;

    @Autowired
    public BrandServiceImpl(BrandRepository brandRepository, BrandValidator brandValidator,
                            PageSizePolicy pageSizePolicy) {
        this.brandRepository = brandRepository;
        this.brandValidator = brandValidator;
        this.pageSizePolicy = pageSizePolicy;
    }

    @Override
    public BrandDto createBrand(CreateBrandRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        String name = brandValidator.validateName(request.getName());
        String description = brandValidator.validateDescription(request.getDescription());
        String website = request.getWebsite() == null || request.getWebsite().isEmpty()
            ? null : request.getWebsite();

        if (brandRepository.existsByName(name, null)) {
            throw new DuplicateException("Brand name '" + name + "' already exists");
        }

        Brand brand = brandRepository.create(new Brand(name, description, website));
        return BrandDto.from(brand);
    }

    @Override
    public BrandDto getBrand(String brandId) {
        return brandRepository.findById(brandId)
            .map(BrandDto::from)
            .orElseThrow(() -> new NotFoundException("Brand not found"));
    }

    @Override
    public BrandDto updateBrand(String brandId, UpdateBrandRequest request) {
        UpdateFieldChecks.requireValidFields(request);

        if (!brandRepository.exists(brandId)) {
            throw new NotFoundException("Brand with ID '" + brandId + "' not found");
        }

        UpdateBrandRequest changes = new UpdateBrandRequest();
        if (request.isSupplied("name")) {
            String name = brandValidator.validateName(request.getName());
            if (brandRepository.existsByName(name, brandId)) {
                throw new DuplicateException("Brand name '" + name + "' already exists");
            }
            changes.setName(name);
        }
        if (request.isSupplied("description")) {
            changes.setDescription(brandValidator.validateDescription(request.getDescription()));
        }
        if (request.getWebsite() != null) {
            String website = request.getWebsite() == null || request.getWebsite().isEmpty()
            ? null : request.getWebsite();
            changes.setWebsite(website == null ? "" : website);
        }

        return BrandDto.from(brandRepository.update(brandId, changes));
    }

    @Override
    public boolean deleteBrand(String brandId) {
        boolean deleted = brandRepository.delete(brandId);
        if (!deleted) {
            logger.debug("Brand {} not found for delete", brandId);
        }
        return deleted;
    }

    @Override
    public boolean brandExists(String brandId) {
        return brandRepository.exists(brandId);
    }

    @Override
    public PageResponse<BrandDto> listBrands(Integer limit, String continuationToken) {
        int pageSize = pageSizePolicy.resolve(limit);
        return PageResponse.from(brandRepository.findAll(pageSize, continuationToken), BrandDto::from);
    }
}

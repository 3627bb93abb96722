package com.productcatalog.api.repository.impl;

import com.productcatalog.api.config.CatalogProperties;
import com.productcatalog.api.dto.UpdateBrandRequest;
import com.productcatalog.api.exception.NotFoundException;
import com.productcatalog.api.model.Brand;
import com.productcatalog.api.repository.BrandRepository;
import com.productcatalog.api.repository.CatalogTableClient;
import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.PaginatedResult;
import com.productcatalog.api.util.UpdateStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public class BrandRepositoryImpl extends CatalogItemRepositorySupport<Brand> implements BrandRepository {

    private static final Logger logger = LoggerFactory.getLogger(BrandRepositoryImpl.class);

    private final int uniquenessCheckPageSize;

    @Autowired
    public BrandRepositoryImpl(CatalogTableClient tableClient, CatalogProperties catalogProperties) {
        super(tableClient, Brand.class, CatalogKeyFactory.BRAND_PREFIX);
        this.uniquenessCheckPageSize = catalogProperties.getUniquenessCheckPageSize();
    }

    @Override
    public Brand create(Brand brand) {
        putNew(brand);
        logger.info("Created brand {} ({})", brand.getId(), brand.getName());
        return brand;
    }

    @Override
    public Optional<Brand> findById(String brandId) {
        return findByKey(keyOf(brandId));
    }

    @Override
    public boolean exists(String brandId) {
        return tableClient.exists(keyOf(brandId));
    }

    @Override
    public Brand update(String brandId, UpdateBrandRequest changes) {
        UpdateStatement update = newUpdate(Instant.now());
        if (changes.getName() != null) {
            update.set("name", changes.getName());
            update.set(CatalogKeyFactory.GSI3_SK, CatalogKeyFactory.getNameSortKey(changes.getName()));
        }
        if (changes.getDescription() != null) {
            update.set("description", changes.getDescription());
        }
        if (changes.getWebsite() != null) {
            if (changes.getWebsite().isEmpty()) {
                update.remove("website");
            } else {
                update.set("website", changes.getWebsite());
            }
        }

        try {
            Brand updated = updateExisting(keyOf(brandId), update);
            logger.info("Updated brand {}", brandId);
            return updated;
        } catch (NotFoundException e) {
            throw new NotFoundException("Brand with ID '" + brandId + "' not found", e);
        }
    }

    @Override
    public boolean delete(String brandId) {
        if (!exists(brandId)) {
            return false;
        }
        tableClient.delete(keyOf(brandId), null);
        logger.info("Deleted brand {}", brandId);
        return true;
    }

    @Override
    public PaginatedResult<Brand> findAll(int limit, String continuationToken) {
        return queryPage(CatalogKeyFactory.gsi3Index(CatalogKeyFactory.BRAND_LIST), limit, continuationToken);
    }

    @Override
    public boolean existsByName(String name, String excludeBrandId) {
        return nameTaken(CatalogKeyFactory.BRAND_LIST, name, excludeBrandId, uniquenessCheckPageSize,
            Brand::getName, Brand::getId);
    }
}

package com.productcatalog.api.testutil;

import com.productcatalog.api.config.CatalogProperties;
import com.productcatalog.api.repository.impl.BrandRepositoryImpl;
import com.productcatalog.api.repository.impl.CategoryRepositoryImpl;
import com.productcatalog.api.repository.impl.ProductRepositoryImpl;
import com.productcatalog.api.service.impl.BrandServiceImpl;
import com.productcatalog.api.service.impl.CategoryServiceImpl;
import com.productcatalog.api.service.impl.PageSizePolicy;
import com.productcatalog.api.service.impl.ProductServiceImpl;
import com.productcatalog.api.validation.BrandValidator;
import com.productcatalog.api.validation.CategoryValidator;
import com.productcatalog.api.validation.ProductValidator;

/**
 * Real services and repositories wired over an {@link InMemoryCatalogTableClient}.
 */
public class CatalogFixture {

    public final InMemoryCatalogTableClient table = new InMemoryCatalogTableClient();
    public final CatalogProperties properties = new CatalogProperties();

    public final BrandRepositoryImpl brandRepository;
    public final CategoryRepositoryImpl categoryRepository;
    public final ProductRepositoryImpl productRepository;

    public final BrandServiceImpl brandService;
    public final CategoryServiceImpl categoryService;
    public final ProductServiceImpl productService;

    public CatalogFixture() {
        brandRepository = new BrandRepositoryImpl(table, properties);
        categoryRepository = new CategoryRepositoryImpl(table, properties);
        productRepository = new ProductRepositoryImpl(table);

        PageSizePolicy pageSizePolicy = new PageSizePolicy(properties);
        brandService = new BrandServiceImpl(brandRepository, new BrandValidator(), pageSizePolicy);
        categoryService = new CategoryServiceImpl(categoryRepository, new CategoryValidator(), pageSizePolicy);
        productService = new ProductServiceImpl(productRepository, brandRepository, categoryRepository,
            new ProductValidator(), pageSizePolicy);
    }
}

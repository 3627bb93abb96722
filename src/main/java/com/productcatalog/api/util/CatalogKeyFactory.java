package com.productcatalog.api.util;

import com.productcatalog.api.exception.InvalidKeyException;

import java.util.Locale;

/**
 * Key factory for the catalog's single-table design.
 *
 * Every entity item uses the same value for both halves of its primary key
 * ({@code BRAND#{id}} / {@code BRAND#{id}}), so the partition key only discriminates
 * entity type and id. Access patterns other than point reads go through one of three
 * secondary indexes:
 * <ul>
 *   <li>GSI-1: inverted index (SK, PK), lists items whose SK starts with a type prefix</li>
 *   <li>GSI-2: (brand_id, product_id), products of a brand</li>
 *   <li>GSI-3: (GSI3PK, GSI3SK), name-sorted entity lists and products of a category</li>
 * </ul>
 */
public final class CatalogKeyFactory {
    private static final String DELIMITER = "#";

    // Primary key attributes
    public static final String PK_FIELD = "PK";
    public static final String SK_FIELD = "SK";

    // Secondary indexes
    public static final String GSI1_NAME = "GSI-1";
    public static final String GSI1_PK = SK_FIELD;
    public static final String GSI1_SK = PK_FIELD;

    public static final String GSI2_NAME = "GSI-2";
    public static final String GSI2_PK = "brand_id";
    public static final String GSI2_SK = "product_id";

    public static final String GSI3_NAME = "GSI-3";
    public static final String GSI3_PK = "GSI3PK";
    public static final String GSI3_SK = "GSI3SK";

    // Entity type prefixes
    public static final String BRAND_PREFIX = "BRAND";
    public static final String CATEGORY_PREFIX = "CATEGORY";
    public static final String PRODUCT_PREFIX = "PRODUCT";
    public static final String PRODUCT_LIST_PREFIX = "PRODUCT_LIST";

    // GSI-3 list partitions
    public static final String BRAND_LIST = "BRAND_LIST";
    public static final String CATEGORY_LIST = "CATEGORY_LIST";
    public static final String PRODUCT_LIST = "PRODUCT_LIST";

    // entity_type discriminator values
    public static final String ENTITY_TYPE_BRAND = "brand";
    public static final String ENTITY_TYPE_CATEGORY = "category";
    public static final String ENTITY_TYPE_PRODUCT = "product";
    public static final String ENTITY_TYPE_PRODUCT_LIST = "product_list";

    private CatalogKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    private static void validateId(String id, String type) {
        if (id == null || id.trim().isEmpty()) {
            throw new InvalidKeyException(type + " ID cannot be null or empty");
        }
    }

    public static String getEntityPk(String typePrefix, String id) {
        validateId(id, typePrefix);
        return typePrefix + DELIMITER + id;
    }

    public static String getEntitySk(String typePrefix, String id) {
        return getEntityPk(typePrefix, id);
    }

    // Brand keys
    public static String getBrandPk(String brandId) {
        return getEntityPk(BRAND_PREFIX, brandId);
    }

    public static String getBrandSk(String brandId) {
        return getEntitySk(BRAND_PREFIX, brandId);
    }

    // Category keys
    public static String getCategoryPk(String categoryId) {
        return getEntityPk(CATEGORY_PREFIX, categoryId);
    }

    public static String getCategorySk(String categoryId) {
        return getEntitySk(CATEGORY_PREFIX, categoryId);
    }

    // Product keys
    public static String getProductPk(String productId) {
        return getEntityPk(PRODUCT_PREFIX, productId);
    }

    public static String getProductSk(String productId) {
        return getEntitySk(PRODUCT_PREFIX, productId);
    }

    public static String getProductListPk(String productId) {
        return getEntityPk(PRODUCT_LIST_PREFIX, productId);
    }

    public static String getProductListSk(String productId) {
        return getEntitySk(PRODUCT_LIST_PREFIX, productId);
    }

    /**
     * GSI3PK of a product detail item, grouping products under their category.
     */
    public static String getCategoryProductsPartition(String categoryId) {
        return getEntityPk(CATEGORY_PREFIX, categoryId);
    }

    /**
     * GSI3SK used for name-ordered listings.
     */
    public static String getNameSortKey(String name) {
        if (name == null) {
            throw new InvalidKeyException("Name cannot be null");
        }
        return name.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Begins-with value matching every SK of the given entity type.
     */
    public static String getTypePrefix(String typePrefix) {
        return typePrefix + DELIMITER;
    }

    // Index descriptors for the three access patterns

    public static IndexQuery entityListIndex(String typePrefix) {
        return IndexQuery.builder()
            .indexName(GSI1_NAME)
            .pkField(GSI1_PK)
            .skField(GSI1_SK)
            .pkValue(getTypePrefix(typePrefix))
            .build();
    }

    public static IndexQuery productsByBrandIndex(String brandId) {
        validateId(brandId, BRAND_PREFIX);
        return IndexQuery.builder()
            .indexName(GSI2_NAME)
            .pkField(GSI2_PK)
            .skField(GSI2_SK)
            .pkValue(brandId)
            .build();
    }

    public static IndexQuery gsi3Index(String gsi3Pk) {
        return gsi3Index(gsi3Pk, null);
    }

    public static IndexQuery gsi3Index(String gsi3Pk, String gsi3SkPrefix) {
        if (gsi3Pk == null || gsi3Pk.trim().isEmpty()) {
            throw new InvalidKeyException("GSI3PK cannot be null or empty");
        }
        return IndexQuery.builder()
            .indexName(GSI3_NAME)
            .pkField(GSI3_PK)
            .skField(GSI3_SK)
            .pkValue(gsi3Pk)
            .skPrefix(gsi3SkPrefix)
            .build();
    }
}

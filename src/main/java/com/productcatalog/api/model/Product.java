package com.productcatalog.api.model;

import com.productcatalog.api.util.CatalogKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondaryPartitionKey;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbSecondarySortKey;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Product entity for the catalog table.
 *
 * Every product is stored as two physical items:
 *
 * Detail item:
 * - PK = PRODUCT#{id}, SK = PRODUCT#{id}
 * - GSI-2: brand_id / product_id (products of a brand)
 * - GSI-3: GSI3PK = CATEGORY#{categoryId}, GSI3SK = product id (products of a category)
 *
 * List projection (see {@link #toListProjection()}):
 * - PK = PRODUCT_LIST#{id}, SK = PRODUCT_LIST#{id}
 * - GSI-3: GSI3PK = "PRODUCT_LIST", GSI3SK = upper-cased name (name-sorted catalog)
 * - no product_id, so the projection stays out of GSI-2
 *
 * The two items are written one after the other, never atomically.
 */
@DynamoDbBean
public class Product extends BaseItem {

    private String id;
    private String name;
    private String brandId;
    private String productId;   // GSI-2 sort key, detail item only
    private String categoryId;
    private BigDecimal price;
    private Integer stockQuantity;
    private String description; // Optional
    private List<String> images; // Optional, up to 10 image URLs

    // Default constructor for DynamoDB
    public Product() {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_PRODUCT);
    }

    /**
     * Create a new product detail item with a generated id and all index attributes applied.
     */
    public Product(String name, String brandId, String categoryId, BigDecimal price,
                   Integer stockQuantity, String description, List<String> images) {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_PRODUCT);
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.brandId = brandId;
        this.productId = id;
        this.categoryId = categoryId;
        this.price = price;
        this.stockQuantity = stockQuantity;
        this.description = description;
        this.images = images;

        setPk(CatalogKeyFactory.getProductPk(id));
        setSk(CatalogKeyFactory.getProductSk(id));
        setGsi3pk(CatalogKeyFactory.getCategoryProductsPartition(categoryId));
        setGsi3sk(id);
    }

    /**
     * Build the list projection item that carries this product in the name-sorted catalog listing.
     */
    public Product toListProjection() {
        Product listItem = new Product();
        listItem.setEntityType(CatalogKeyFactory.ENTITY_TYPE_PRODUCT_LIST);
        listItem.setId(id);
        listItem.setName(name);
        listItem.setBrandId(brandId);
        listItem.setCategoryId(categoryId);
        listItem.setPrice(price);
        listItem.setStockQuantity(stockQuantity);
        listItem.setDescription(description);
        listItem.setImages(images == null ? null : new ArrayList<>(images));
        listItem.setCreatedAt(getCreatedAt());
        listItem.setUpdatedAt(getUpdatedAt());

        listItem.setPk(CatalogKeyFactory.getProductListPk(id));
        listItem.setSk(CatalogKeyFactory.getProductListSk(id));
        listItem.setGsi3pk(CatalogKeyFactory.PRODUCT_LIST);
        listItem.setGsi3sk(CatalogKeyFactory.getNameSortKey(name));
        return listItem;
    }

    @DynamoDbAttribute("id")
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    @DynamoDbAttribute("name")
    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = CatalogKeyFactory.GSI2_NAME)
    @DynamoDbAttribute(CatalogKeyFactory.GSI2_PK)
    public String getBrandId() {
        return brandId;
    }

    public void setBrandId(String brandId) {
        this.brandId = brandId;
    }

    @DynamoDbSecondarySortKey(indexNames = CatalogKeyFactory.GSI2_NAME)
    @DynamoDbAttribute(CatalogKeyFactory.GSI2_SK)
    public String getProductId() {
        return productId;
    }

    public void setProductId(String productId) {
        this.productId = productId;
    }

    @DynamoDbAttribute("category_id")
    public String getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(String categoryId) {
        this.categoryId = categoryId;
    }

    @DynamoDbAttribute("price")
    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    @DynamoDbAttribute("stock_quantity")
    public Integer getStockQuantity() {
        return stockQuantity;
    }

    public void setStockQuantity(Integer stockQuantity) {
        this.stockQuantity = stockQuantity;
    }

    @DynamoDbAttribute("description")
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @DynamoDbAttribute("images")
    public List<String> getImages() {
        return images;
    }

    public void setImages(List<String> images) {
        this.images = images;
    }
}

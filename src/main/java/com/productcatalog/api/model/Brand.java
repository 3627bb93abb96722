package com.productcatalog.api.model;

import com.productcatalog.api.util.CatalogKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * Brand entity for the catalog table.
 *
 * Key Patterns:
 * - PK = BRAND#{id}, SK = BRAND#{id}
 *
 * GSI-3 (name-sorted brand list):
 * - GSI3PK = "BRAND_LIST"
 * - GSI3SK = upper-cased name
 */
@DynamoDbBean
public class Brand extends BaseItem {

    private String id;
    private String name;
    private String description;
    private String website; // Optional, http(s) only

    // Default constructor for DynamoDB
    public Brand() {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_BRAND);
    }

    /**
     * Create a new brand with a generated id and all index attributes applied.
     */
    public Brand(String name, String description, String website) {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_BRAND);
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.description = description;
        this.website = website;

        setPk(CatalogKeyFactory.getBrandPk(id));
        setSk(CatalogKeyFactory.getBrandSk(id));
        setGsi3pk(CatalogKeyFactory.BRAND_LIST);
        setGsi3sk(CatalogKeyFactory.getNameSortKey(name));
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

    @DynamoDbAttribute("description")
    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    @DynamoDbAttribute("website")
    public String getWebsite() {
        return website;
    }

    public void setWebsite(String website) {
        this.website = website;
    }
}

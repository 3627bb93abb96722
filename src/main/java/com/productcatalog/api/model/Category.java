package com.productcatalog.api.model;

import com.productcatalog.api.util.CatalogKeyFactory;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.UUID;

/**
 * Category entity for the catalog table.
 *
 * Key Patterns:
 * - PK = CATEGORY#{id}, SK = CATEGORY#{id}
 *
 * GSI-3 (name-sorted category list):
 * - GSI3PK = "CATEGORY_LIST"
 * - GSI3SK = upper-cased name
 *
 * Products of the category live in a different GSI-3 partition (CATEGORY#{id}),
 * so they never show up in the category list.
 */
@DynamoDbBean
public class Category extends BaseItem {

    private String id;
    private String name;
    private String description;

    // Default constructor for DynamoDB
    public Category() {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_CATEGORY);
    }

    public Category(String name, String description) {
        super();
        setEntityType(CatalogKeyFactory.ENTITY_TYPE_CATEGORY);
        this.id = UUID.randomUUID().toString();
        this.name = name;
        this.description = description;

        setPk(CatalogKeyFactory.getCategoryPk(id));
        setSk(CatalogKeyFactory.getCategorySk(id));
        setGsi3pk(CatalogKeyFactory.CATEGORY_LIST);
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
}

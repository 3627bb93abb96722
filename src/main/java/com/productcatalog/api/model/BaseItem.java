package com.productcatalog.api.model;

import com.productcatalog.api.util.CatalogKeyFactory;
import com.productcatalog.api.util.InstantAsIsoStringAttributeConverter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.*;

import java.time.Instant;

/**
 * Base class for all items stored in the catalog table.
 * Provides the primary key, the flexible GSI-3 key and the common audit attributes.
 */
@DynamoDbBean
public abstract class BaseItem {

    private String pk;          // Partition Key, always equal to sk
    private String sk;          // Sort Key
    private String gsi3pk;      // GSI-3 Partition Key (list partition or CATEGORY#{id})
    private String gsi3sk;      // GSI-3 Sort Key (upper-cased name or product id)
    private String entityType;  // Type discriminator
    private Instant createdAt;
    private Instant updatedAt;

    public BaseItem() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @DynamoDbPartitionKey
    @DynamoDbAttribute(CatalogKeyFactory.PK_FIELD)
    public String getPk() {
        return pk;
    }

    public void setPk(String pk) {
        this.pk = pk;
    }

    @DynamoDbSortKey
    @DynamoDbAttribute(CatalogKeyFactory.SK_FIELD)
    public String getSk() {
        return sk;
    }

    public void setSk(String sk) {
        this.sk = sk;
    }

    @DynamoDbSecondaryPartitionKey(indexNames = CatalogKeyFactory.GSI3_NAME)
    @DynamoDbAttribute(CatalogKeyFactory.GSI3_PK)
    public String getGsi3pk() {
        return gsi3pk;
    }

    public void setGsi3pk(String gsi3pk) {
        this.gsi3pk = gsi3pk;
    }

    @DynamoDbSecondarySortKey(indexNames = CatalogKeyFactory.GSI3_NAME)
    @DynamoDbAttribute(CatalogKeyFactory.GSI3_SK)
    public String getGsi3sk() {
        return gsi3sk;
    }

    public void setGsi3sk(String gsi3sk) {
        this.gsi3sk = gsi3sk;
    }

    @DynamoDbAttribute("entity_type")
    public String getEntityType() {
        return entityType;
    }

    public void setEntityType(String entityType) {
        this.entityType = entityType;
    }

    @DynamoDbAttribute("created_at")
    @DynamoDbConvertedBy(InstantAsIsoStringAttributeConverter.class)
    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    @DynamoDbAttribute("updated_at")
    @DynamoDbConvertedBy(InstantAsIsoStringAttributeConverter.class)
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}

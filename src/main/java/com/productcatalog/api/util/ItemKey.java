package com.productcatalog.api.util;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.Map;
import java.util.Objects;

/**
 * Primary key (PK, SK) of one table item, used for batch reads and deletes.
 */
public final class ItemKey {

    private final String pk;
    private final String sk;

    public ItemKey(String pk, String sk) {
        this.pk = pk;
        this.sk = sk;
    }

    public static ItemKey of(String pk, String sk) {
        return new ItemKey(pk, sk);
    }

    public String getPk() {
        return pk;
    }

    public String getSk() {
        return sk;
    }

    public Map<String, AttributeValue> toAttributeMap() {
        return Map.of(
            CatalogKeyFactory.PK_FIELD, AttributeValue.builder().s(pk).build(),
            CatalogKeyFactory.SK_FIELD, AttributeValue.builder().s(sk).build()
        );
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ItemKey)) return false;
        ItemKey other = (ItemKey) o;
        return Objects.equals(pk, other.pk) && Objects.equals(sk, other.sk);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pk, sk);
    }

    @Override
    public String toString() {
        return pk + "/" + sk;
    }
}

package com.productcatalog.api.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.productcatalog.api.exception.ValidationException;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Encodes a DynamoDB LastEvaluatedKey as an opaque continuation token and back.
 * The token is URL-safe Base64 over the JSON form of the key attributes.
 */
public final class PaginationTokenCodec {

    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> KEY_TYPE = new TypeReference<>() {};

    private PaginationTokenCodec() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @return the token, or null when there is no next page
     */
    public static String encode(Map<String, AttributeValue> lastEvaluatedKey) {
        if (lastEvaluatedKey == null || lastEvaluatedKey.isEmpty()) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(AttributeValueConverter.toPlainMap(lastEvaluatedKey));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to encode pagination token", e);
        }
    }

    /**
     * @return the exclusive start key, or null for a blank token
     * @throws ValidationException if the token was not produced by {@link #encode}
     */
    public static Map<String, AttributeValue> decode(String token) {
        if (token == null || token.trim().isEmpty()) {
            return null;
        }
        try {
            byte[] decoded = Base64.getUrlDecoder().decode(token.trim());
            Map<String, Object> key = objectMapper.readValue(new String(decoded, StandardCharsets.UTF_8), KEY_TYPE);
            if (key == null || key.isEmpty()) {
                throw new ValidationException("Invalid continuation token");
            }
            return AttributeValueConverter.toAttributeValueMap(key);
        } catch (ValidationException e) {
            throw e;
        } catch (Exception e) {
            throw new ValidationException("Invalid continuation token", e);
        }
    }

    /**
     * Decodes a token for a query on {@code index}. The key must hold exactly the table and
     * index key attributes as strings and sit inside the partition (and sort-key prefix) queried,
     * so a token from another listing is rejected here instead of by DynamoDB.
     *
     * @return the exclusive start key, or null for a blank token
     */
    public static Map<String, AttributeValue> decodeQueryStartKey(String token, IndexQuery index) {
        Map<String, AttributeValue> key = decodeIndexKey(token, index);
        if (key == null) {
            return null;
        }
        if (!index.getPkValue().equals(key.get(index.getPkField()).s())) {
            throw new ValidationException("Invalid continuation token");
        }
        if (index.hasSkPrefix() && !key.get(index.getSkField()).s().startsWith(index.getSkPrefix())) {
            throw new ValidationException("Invalid continuation token");
        }
        return key;
    }

    /**
     * Decodes a token for a scan of {@code index}. Only the key shape is checked: a filtered
     * scan may stop on an item outside the filter.
     *
     * @return the exclusive start key, or null for a blank token
     */
    public static Map<String, AttributeValue> decodeScanStartKey(String token, IndexQuery index) {
        return decodeIndexKey(token, index);
    }

    private static Map<String, AttributeValue> decodeIndexKey(String token, IndexQuery index) {
        Map<String, AttributeValue> key = decode(token);
        if (key == null) {
            return null;
        }
        Set<String> expected = new HashSet<>();
        expected.add(CatalogKeyFactory.PK_FIELD);
        expected.add(CatalogKeyFactory.SK_FIELD);
        expected.add(index.getPkField());
        expected.add(index.getSkField());
        if (!key.keySet().equals(expected)) {
            throw new ValidationException("Invalid continuation token");
        }
        for (AttributeValue value : key.values()) {
            if (value.s() == null || value.s().isEmpty()) {
                throw new ValidationException("Invalid continuation token");
            }
        }
        return key;
    }
}

package com.productcatalog.api.util;

import com.productcatalog.api.exception.ValidationException;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class PaginationTokenCodecTest {

    @Test
    void encode_LastEvaluatedKey_DecodesToSameKey() {
        Map<String, AttributeValue> lastKey = Map.of(
            "PK", AttributeValue.builder().s("BRAND#1").build(),
            "SK", AttributeValue.builder().s("BRAND#1").build(),
            "GSI3PK", AttributeValue.builder().s("BRAND_LIST").build(),
            "GSI3SK", AttributeValue.builder().s("ACME").build());

        String token = PaginationTokenCodec.encode(lastKey);

        assertThat(token).doesNotContain("=", "+", "/");
        assertThat(PaginationTokenCodec.decode(token)).isEqualTo(lastKey);
    }

    @Test
    void encode_NoKey_ReturnsNull() {
        assertThat(PaginationTokenCodec.encode(null)).isNull();
        assertThat(PaginationTokenCodec.encode(Map.of())).isNull();
    }

    @Test
    void decode_BlankToken_ReturnsNull() {
        assertThat(PaginationTokenCodec.decode(null)).isNull();
        assertThat(PaginationTokenCodec.decode("  ")).isNull();
    }

    @Test
    void decode_Garbage_ThrowsValidation() {
        assertThatThrownBy(() -> PaginationTokenCodec.decode("not a token!"))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid continuation token");
    }

    @Test
    void decode_EmptyJsonObject_ThrowsValidation() {
        String token = Base64.getUrlEncoder().encodeToString("{}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> PaginationTokenCodec.decode(token))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid continuation token");
    }

    @Test
    void decodeQueryStartKey_KeyOfSameListing_ReturnsKey() {
        Map<String, AttributeValue> lastKey = brandListKey("BRAND_LIST", "ACME");

        assertThat(PaginationTokenCodec.decodeQueryStartKey(PaginationTokenCodec.encode(lastKey),
            CatalogKeyFactory.gsi3Index("BRAND_LIST"))).isEqualTo(lastKey);
    }

    @Test
    void decodeQueryStartKey_UnrelatedAttributes_ThrowsValidation() {
        String token = Base64.getUrlEncoder().encodeToString("{\"foo\":\"bar\"}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> PaginationTokenCodec.decodeQueryStartKey(token, CatalogKeyFactory.gsi3Index("BRAND_LIST")))
            .isInstanceOf(ValidationException.class)
            .hasMessage("Invalid continuation token");
    }

    @Test
    void decodeQueryStartKey_OtherPartition_ThrowsValidation() {
        String token = PaginationTokenCodec.encode(brandListKey("CATEGORY_LIST", "ACME"));

        assertThatThrownBy(() -> PaginationTokenCodec.decodeQueryStartKey(token, CatalogKeyFactory.gsi3Index("BRAND_LIST")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void decodeQueryStartKey_OutsideSortKeyPrefix_ThrowsValidation() {
        String token = PaginationTokenCodec.encode(brandListKey("BRAND_LIST", "ZENITH"));

        assertThatThrownBy(() -> PaginationTokenCodec.decodeQueryStartKey(token,
                CatalogKeyFactory.gsi3Index("BRAND_LIST", "ACME")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void decodeQueryStartKey_ExtraAttribute_ThrowsValidation() {
        Map<String, AttributeValue> lastKey = new HashMap<>(brandListKey("BRAND_LIST", "ACME"));
        lastKey.put("name", AttributeValue.builder().s("Acme").build());
        String token = PaginationTokenCodec.encode(lastKey);

        assertThatThrownBy(() -> PaginationTokenCodec.decodeQueryStartKey(token, CatalogKeyFactory.gsi3Index("BRAND_LIST")))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void decodeScanStartKey_ChecksShapeOnly() {
        Map<String, AttributeValue> lastKey = Map.of(
            "PK", AttributeValue.builder().s("CATEGORY#1").build(),
            "SK", AttributeValue.builder().s("CATEGORY#1").build());
        IndexQuery brands = CatalogKeyFactory.entityListIndex("BRAND");

        assertThat(PaginationTokenCodec.decodeScanStartKey(PaginationTokenCodec.encode(lastKey), brands))
            .isEqualTo(lastKey);
        assertThatThrownBy(() -> PaginationTokenCodec.decodeScanStartKey(
                PaginationTokenCodec.encode(brandListKey("BRAND_LIST", "ACME")), brands))
            .isInstanceOf(ValidationException.class);
    }

    private static Map<String, AttributeValue> brandListKey(String gsi3Pk, String gsi3Sk) {
        return Map.of(
            "PK", AttributeValue.builder().s("BRAND#1").build(),
            "SK", AttributeValue.builder().s("BRAND#1").build(),
            "GSI3PK", AttributeValue.builder().s(gsi3Pk).build(),
            "GSI3SK", AttributeValue.builder().s(gsi3Sk).build());
    }
}

package com.productcatalog.api.util;

import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class AttributeValueConverterTest {

    @Test
    void toAttributeValue_Double_IsStoredAsShortestDecimal() {
        assertThat(AttributeValueConverter.toAttributeValue(19.99).n()).isEqualTo("19.99");
        assertThat(AttributeValueConverter.toAttributeValue(0.1f).n()).isEqualTo("0.1");
    }

    @Test
    void toAttributeValue_BigDecimal_KeepsScale() {
        assertThat(AttributeValueConverter.toAttributeValue(new BigDecimal("5.50")).n()).isEqualTo("5.50");
        assertThat(AttributeValueConverter.toAttributeValue(new BigDecimal("1E+3")).n()).isEqualTo("1000");
    }

    @Test
    void toAttributeValue_NonFiniteDouble_ShouldThrowException() {
        assertThatThrownBy(() -> AttributeValueConverter.toAttributeValue(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void toAttributeValue_NestedCollections() {
        AttributeValue value = AttributeValueConverter.toAttributeValue(
            Map.of("images", List.of("https://cdn.example.com/a.png")));

        assertThat(value.m().get("images").l()).extracting(AttributeValue::s)
            .containsExactly("https://cdn.example.com/a.png");
    }

    @Test
    void toAttributeValue_UnsupportedType_ShouldThrowException() {
        assertThatThrownBy(() -> AttributeValueConverter.toAttributeValue(new Object()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Unsupported attribute type");
    }

    @Test
    void toPlainValue_Numbers_AreLongWhenIntegral() {
        assertThat(AttributeValueConverter.toPlainValue(AttributeValue.builder().n("20.00").build())).isEqualTo(20L);
        assertThat(AttributeValueConverter.toPlainValue(AttributeValue.builder().n("19.99").build())).isEqualTo(19.99);
        assertThat(AttributeValueConverter.toPlainValue(AttributeValue.builder().nul(true).build())).isNull();
    }

    @Test
    void normalizeNumber_Zero_IsLong() {
        assertThat(AttributeValueConverter.normalizeNumber(new BigDecimal("0.00"))).isEqualTo(0L);
        assertThat(AttributeValueConverter.normalizeNumber(null)).isNull();
    }
}

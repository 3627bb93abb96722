package com.productcatalog.api.util;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts between plain Java values and DynamoDB attribute values.
 *
 * Numbers are always written as exact decimals: floating point inputs go through their
 * shortest decimal string rather than their binary expansion, so 19.99 is stored as
 * {@code 19.99} and never as {@code 19.989999999999998}. On the way back out, integral
 * decimals become {@link Long} and everything else becomes {@link Double}, so JSON
 * consumers see {@code 20} rather than {@code 20.0}.
 */
public final class AttributeValueConverter {

    private AttributeValueConverter() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static AttributeValue toAttributeValue(Object value) {
        if (value == null) {
            return AttributeValue.builder().nul(true).build();
        }
        if (value instanceof AttributeValue) {
            return (AttributeValue) value;
        }
        if (value instanceof String) {
            return AttributeValue.builder().s((String) value).build();
        }
        if (value instanceof Boolean) {
            return AttributeValue.builder().bool((Boolean) value).build();
        }
        if (value instanceof Number) {
            return AttributeValue.builder().n(toDecimal((Number) value).toPlainString()).build();
        }
        if (value instanceof Collection) {
            List<AttributeValue> values = new ArrayList<>();
            for (Object element : (Collection<?>) value) {
                values.add(toAttributeValue(element));
            }
            return AttributeValue.builder().l(values).build();
        }
        if (value instanceof Map) {
            Map<String, AttributeValue> values = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                values.put(String.valueOf(entry.getKey()), toAttributeValue(entry.getValue()));
            }
            return AttributeValue.builder().m(values).build();
        }
        throw new IllegalArgumentException("Unsupported attribute type: " + value.getClass().getName());
    }

    public static Map<String, AttributeValue> toAttributeValueMap(Map<String, ?> values) {
        Map<String, AttributeValue> result = new LinkedHashMap<>();
        values.forEach((name, value) -> result.put(name, toAttributeValue(value)));
        return result;
    }

    public static Object toPlainValue(AttributeValue value) {
        if (value == null || Boolean.TRUE.equals(value.nul())) {
            return null;
        }
        if (value.s() != null) {
            return value.s();
        }
        if (value.n() != null) {
            return normalizeNumber(new BigDecimal(value.n()));
        }
        if (value.bool() != null) {
            return value.bool();
        }
        if (value.hasL()) {
            List<Object> values = new ArrayList<>();
            value.l().forEach(element -> values.add(toPlainValue(element)));
            return values;
        }
        if (value.hasM()) {
            return toPlainMap(value.m());
        }
        if (value.hasSs()) {
            return new ArrayList<>(value.ss());
        }
        if (value.hasNs()) {
            List<Object> values = new ArrayList<>();
            value.ns().forEach(n -> values.add(normalizeNumber(new BigDecimal(n))));
            return values;
        }
        return null;
    }

    public static Map<String, Object> toPlainMap(Map<String, AttributeValue> item) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (item != null) {
            item.forEach((name, value) -> result.put(name, toPlainValue(value)));
        }
        return result;
    }

    /**
     * Exact decimal for any numeric input.
     */
    public static BigDecimal toDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if (number instanceof Double || number instanceof Float) {
            double d = number.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Cannot store non-finite number: " + number);
            }
            // Float.toString keeps the short form for floats (0.1f -> "0.1")
            return number instanceof Float ? new BigDecimal(number.toString()) : BigDecimal.valueOf(d);
        }
        return new BigDecimal(number.toString());
    }

    /**
     * JSON-friendly number: Long when integral, Double otherwise.
     */
    public static Number normalizeNumber(BigDecimal decimal) {
        if (decimal == null) {
            return null;
        }
        if (decimal.signum() == 0 || decimal.stripTrailingZeros().scale() <= 0) {
            try {
                return decimal.longValueExact();
            } catch (ArithmeticException e) {
                return decimal.doubleValue();
            }
        }
        return decimal.doubleValue();
    }
}

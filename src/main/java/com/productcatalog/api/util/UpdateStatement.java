package com.productcatalog.api.util;

import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builder for an UpdateItem expression.
 *
 * Attribute names are always aliased ({@code #attr0}) so reserved words such as
 * {@code name} and index attributes such as {@code GSI3SK} can be set safely.
 * Values go through {@link AttributeValueConverter}, so doubles are stored as exact decimals.
 */
public final class UpdateStatement {

    private final Map<String, AttributeValue> sets = new LinkedHashMap<>();
    private final List<String> removes = new ArrayList<>();

    public UpdateStatement set(String attribute, Object value) {
        removes.remove(attribute);
        sets.put(attribute, AttributeValueConverter.toAttributeValue(value));
        return this;
    }

    public UpdateStatement remove(String attribute) {
        sets.remove(attribute);
        if (!removes.contains(attribute)) {
            removes.add(attribute);
        }
        return this;
    }

    public boolean isEmpty() {
        return sets.isEmpty() && removes.isEmpty();
    }

    public Map<String, AttributeValue> getSets() {
        return Collections.unmodifiableMap(sets);
    }

    public List<String> getRemoves() {
        return Collections.unmodifiableList(removes);
    }

    /**
     * Copy holding only the given attributes; used to mirror part of an update onto a second item.
     */
    public UpdateStatement copyOf(Iterable<String> attributes) {
        UpdateStatement copy = new UpdateStatement();
        for (String attribute : attributes) {
            if (sets.containsKey(attribute)) {
                copy.sets.put(attribute, sets.get(attribute));
            } else if (removes.contains(attribute)) {
                copy.removes.add(attribute);
            }
        }
        return copy;
    }

    public String toExpression() {
        StringBuilder expression = new StringBuilder();
        int index = 0;
        if (!sets.isEmpty()) {
            expression.append("SET ");
            int setIndex = 0;
            for (String ignored : sets.keySet()) {
                if (setIndex > 0) expression.append(", ");
                expression.append("#attr").append(index).append(" = :val").append(index);
                index++;
                setIndex++;
            }
        }
        if (!removes.isEmpty()) {
            if (expression.length() > 0) expression.append(' ');
            expression.append("REMOVE ");
            for (int i = 0; i < removes.size(); i++) {
                if (i > 0) expression.append(", ");
                expression.append("#attr").append(index);
                index++;
            }
        }
        return expression.toString();
    }

    public Map<String, String> toAttributeNames() {
        Map<String, String> names = new HashMap<>();
        int index = 0;
        for (String attribute : sets.keySet()) {
            names.put("#attr" + index, attribute);
            index++;
        }
        for (String attribute : removes) {
            names.put("#attr" + index, attribute);
            index++;
        }
        return names;
    }

    public Map<String, AttributeValue> toAttributeValues() {
        Map<String, AttributeValue> values = new HashMap<>();
        int index = 0;
        for (AttributeValue value : sets.values()) {
            values.put(":val" + index, value);
            index++;
        }
        return values;
    }
}

package com.productcatalog.api.dto;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.HashSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Base for partial-update requests. Setters record which fields the caller sent, so an
 * explicit {@code null} can be told apart from an absent key. JSON keys that do not map to an
 * updatable field are collected so the service can reject them by name.
 */
public abstract class PartialUpdateRequest {

    @JsonIgnore
    private final Set<String> unknownFields = new TreeSet<>();

    @JsonIgnore
    private final Set<String> suppliedFields = new HashSet<>();

    @JsonAnySetter
    public void addUnknownField(String name, Object value) {
        unknownFields.add(name);
    }

    @JsonIgnore
    public Set<String> getUnknownFields() {
        return unknownFields;
    }

    @JsonIgnore
    public boolean hasUnknownFields() {
        return !unknownFields.isEmpty();
    }

    protected void markSupplied(String field) {
        suppliedFields.add(field);
    }

    /**
     * @param field Java property name, e.g. {@code brandId}
     */
    public boolean isSupplied(String field) {
        return suppliedFields.contains(field);
    }

    /**
     * @return true when no updatable field was supplied
     */
    @JsonIgnore
    public boolean isEmpty() {
        return suppliedFields.isEmpty();
    }
}

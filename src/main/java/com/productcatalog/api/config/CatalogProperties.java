package com.productcatalog.api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "catalog")
public class CatalogProperties {

    private String tableName = "products_catalog";

    private int defaultPageSize = 50;

    private int maxPageSize = 100;

    // Page size of the GSI-3 query behind the case-insensitive name check
    private int uniquenessCheckPageSize = 100;

    private final Cors cors = new Cors();

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }

    public int getUniquenessCheckPageSize() {
        return uniquenessCheckPageSize;
    }

    public void setUniquenessCheckPageSize(int uniquenessCheckPageSize) {
        this.uniquenessCheckPageSize = uniquenessCheckPageSize;
    }

    public Cors getCors() {
        return cors;
    }

    public static class Cors {

        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

        private List<String> allowedHeaders = new ArrayList<>(List.of(
            "Content-Type", "X-Amz-Date", "Authorization", "X-Api-Key", "X-Amz-Security-Token"));

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }

        public List<String> getAllowedHeaders() {
            return allowedHeaders;
        }

        public void setAllowedHeaders(List<String> allowedHeaders) {
            this.allowedHeaders = allowedHeaders;
        }
    }
}

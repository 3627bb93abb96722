package com.productcatalog.api.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS for the catalog endpoints.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CatalogProperties catalogProperties;

    @Autowired
    public WebConfig(CatalogProperties catalogProperties) {
        this.catalogProperties = catalogProperties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        CatalogProperties.Cors cors = catalogProperties.getCors();
        registry.addMapping("/**")
            .allowedOriginPatterns(cors.getAllowedOrigins().toArray(new String[0]))
            .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
            .allowedHeaders(cors.getAllowedHeaders().toArray(new String[0]));
    }
}

package com.productcatalog.api.dto;

import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

/**
 * Request DTO for creating a new brand.
 * Name and description rules are applied after trimming, in the service.
 */
@Data
@NoArgsConstructor
public class CreateBrandRequest {

    private String name;

    private String description;

    @Pattern(regexp = RequestFieldRules.HTTP_SCHEME_OR_NONE, message = "Website URL must use http or https protocol")
    @URL(regexp = RequestFieldRules.WEBSITE, message = "Invalid website URL format")
    private String website; // Optional

    public CreateBrandRequest(String name, String description, String website) {
        this.name = name;
        this.description = description;
        setWebsite(website);
    }

    public void setWebsite(String website) {
        this.website = RequestFieldRules.trimWebsite(website);
    }
}

package com.productcatalog.api.dto;

import jakarta.validation.constraints.Pattern;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.hibernate.validator.constraints.URL;

/**
 * Request DTO for updating a brand. Absent fields are left unchanged;
 * an empty or null website removes the stored website.
 */
@Data
@NoArgsConstructor
@EqualsAndHashCode(callSuper = false)
public class UpdateBrandRequest extends PartialUpdateRequest {

    private String name;

    private String description;

    @Pattern(regexp = RequestFieldRules.HTTP_SCHEME_OR_NONE, message = "Website URL must use http or https protocol")
    @URL(regexp = RequestFieldRules.WEBSITE, message = "Invalid website URL format")
    private String website;

    public void setName(String name) {
        this.name = name;
        markSupplied("name");
    }

    public void setDescription(String description) {
        this.description = description;
        markSupplied("description");
    }

    public void setWebsite(String website) {
        this.website = RequestFieldRules.trimWebsite(website);
        markSupplied("website");
    }
}

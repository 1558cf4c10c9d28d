package com.companyintel.profiles.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One company in the output directory. Every field is a string and never null once the
 * profile has been through schema coercion; {@code domain} is the identity key.
 */
@JsonPropertyOrder({
    "domain", "company_name", "logo", "short_description", "long_description",
    "sector", "industry", "sub_industry", "sic_code", "sic_text", "tags"
})
public record CompanyProfile(
    @JsonProperty("domain") String domain,
    @JsonProperty("company_name") String companyName,
    @JsonProperty("logo") String logo,
    @JsonProperty("short_description") String shortDescription,
    @JsonProperty("long_description") String longDescription,
    @JsonProperty("sector") String sector,
    @JsonProperty("industry") String industry,
    @JsonProperty("sub_industry") String subIndustry,
    @JsonProperty("sic_code") String sicCode,
    @JsonProperty("sic_text") String sicText,
    @JsonProperty("tags") String tags
) {
    public CompanyProfile withCompanyName(String value) {
        return new CompanyProfile(domain, value, logo, shortDescription, longDescription,
            sector, industry, subIndustry, sicCode, sicText, tags);
    }

    public CompanyProfile withLogo(String value) {
        return new CompanyProfile(domain, companyName, value, shortDescription, longDescription,
            sector, industry, subIndustry, sicCode, sicText, tags);
    }

    public CompanyProfile withLongDescription(String value) {
        return new CompanyProfile(domain, companyName, logo, shortDescription, value,
            sector, industry, subIndustry, sicCode, sicText, tags);
    }
}

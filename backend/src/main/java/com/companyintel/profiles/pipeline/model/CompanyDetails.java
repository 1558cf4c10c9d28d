package com.companyintel.profiles.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompanyDetails(
    ContactInfo contact,
    List<String> technologies,
    CompanyMetadata metadata
) {
}

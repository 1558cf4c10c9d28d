package com.companyintel.profiles.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompanyDetailView(
    CompanyProfile profile,
    CompanyDetails details
) {
}

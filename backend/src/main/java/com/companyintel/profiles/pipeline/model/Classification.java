package com.companyintel.profiles.pipeline.model;

public record Classification(
    String sector,
    String industry,
    String subIndustry,
    String sicCode,
    String sicText,
    String tags
) {
}

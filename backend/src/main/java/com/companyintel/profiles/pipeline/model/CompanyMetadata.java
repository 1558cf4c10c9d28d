package com.companyintel.profiles.pipeline.model;

import java.util.Map;

public record CompanyMetadata(
    String companyType,
    Integer foundedYear,
    String employeeCountEstimate,
    String headquarters,
    Map<String, Double> confidence
) {
}

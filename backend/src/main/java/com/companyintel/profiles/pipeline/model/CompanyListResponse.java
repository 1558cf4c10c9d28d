package com.companyintel.profiles.pipeline.model;

import java.util.List;

public record CompanyListResponse(
    List<CompanySummaryView> companies,
    int total
) {
}

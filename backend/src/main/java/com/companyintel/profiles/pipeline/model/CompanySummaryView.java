package com.companyintel.profiles.pipeline.model;

public record CompanySummaryView(
    String domain,
    String companyName,
    String logo,
    String sector,
    String shortDescription
) {
    public static CompanySummaryView of(CompanyProfile profile) {
        return new CompanySummaryView(
            profile.domain(),
            profile.companyName(),
            profile.logo(),
            profile.sector(),
            profile.shortDescription()
        );
    }
}

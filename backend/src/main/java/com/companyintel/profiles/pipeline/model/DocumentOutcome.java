package com.companyintel.profiles.pipeline.model;

public record DocumentOutcome(
    String domain,
    CompanyProfile profile,
    CompanyDetails details,
    String reasonCode
) {
    public static DocumentOutcome accepted(CompanyProfile profile, CompanyDetails details) {
        return new DocumentOutcome(profile.domain(), profile, details, null);
    }

    public static DocumentOutcome failed(String domain, String reasonCode) {
        return new DocumentOutcome(domain, null, null, reasonCode);
    }

    public boolean isAccepted() {
        return profile != null;
    }
}

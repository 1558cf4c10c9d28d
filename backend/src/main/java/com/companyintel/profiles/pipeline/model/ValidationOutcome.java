package com.companyintel.profiles.pipeline.model;

/**
 * Result of the quality gate: either an accepted (possibly repaired) profile or a rejection
 * reason for the owning domain, never both.
 */
public record ValidationOutcome(
    String domain,
    CompanyProfile profile,
    String reasonCode
) {
    public ValidationOutcome {
        if ((profile == null) == (reasonCode == null)) {
            throw new IllegalArgumentException(
                "Validation outcome for " + domain + " needs exactly one of profile or reason code"
            );
        }
    }

    public static ValidationOutcome accepted(CompanyProfile profile) {
        return new ValidationOutcome(profile.domain(), profile, null);
    }

    public static ValidationOutcome rejected(String domain, String reasonCode) {
        return new ValidationOutcome(domain, null, reasonCode);
    }

    public boolean isAccepted() {
        return profile != null;
    }
}

package com.companyintel.profiles.pipeline.quality;

import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.ValidationOutcome;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QualityGateTest {
    private final QualityGate gate = new QualityGate();

    @Test
    void rejectsEmptyShortDescription() {
        ValidationOutcome outcome = gate.validate(Map.of(
            "domain", "bad.com",
            "short_description", "",
            "sector", "Technology",
            "industry", "Software"
        ));

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.domain()).isEqualTo("bad.com");
        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.EMPTY_SHORT_DESCRIPTION);
    }

    @Test
    void outcomeCarriesEitherProfileOrReasonButNeverBoth() {
        CompanyProfile profile = new CompanyProfile("acme.com", "Acme", "", "Acme builds robots.", "Acme builds robots.",
            "Technology", "Software", "Software", "7372", "Prepackaged Software", "Technology, Software");

        assertThatThrownBy(() -> new ValidationOutcome("acme.com", profile, ReasonCodes.EMPTY_SECTOR))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValidationOutcome("acme.com", null, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(ValidationOutcome.accepted(profile).reasonCode()).isNull();
        assertThat(ValidationOutcome.rejected("acme.com", ReasonCodes.EMPTY_SECTOR).profile()).isNull();
    }

    @Test
    void rejectsUnknownIndustryCaseInsensitively() {
        ValidationOutcome outcome = gate.validate(raw("acme.com", "UNKNOWN", "Technology"));

        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.UNKNOWN_INDUSTRY);
    }

    @Test
    void rejectsMissingIndustryBeforeMissingSector() {
        ValidationOutcome outcome = gate.validate(raw("acme.com", null, null));

        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.UNKNOWN_INDUSTRY);
    }

    @Test
    void rejectsEmptySector() {
        ValidationOutcome outcome = gate.validate(raw("acme.com", "Software", "  "));

        assertThat(outcome.reasonCode()).isEqualTo(ReasonCodes.EMPTY_SECTOR);
    }

    @Test
    void repairsNameLongDescriptionAndLogo() {
        Map<String, Object> raw = raw("www.acme.com", "Software", "Technology");
        raw.put("logo", "/favicon.ico");

        ValidationOutcome outcome = gate.validate(raw);

        assertThat(outcome.isAccepted()).isTrue();
        CompanyProfile profile = outcome.profile();
        assertThat(profile.companyName()).isEqualTo("Acme");
        assertThat(profile.longDescription()).isEqualTo(profile.shortDescription());
        assertThat(profile.logo()).isEmpty();
    }

    @Test
    void keepsValidValuesUntouched() {
        Map<String, Object> raw = raw("acme.com", "Software", "Technology");
        raw.put("company_name", "Acme Corp");
        raw.put("logo", "https://acme.com/logo.png");
        raw.put("long_description", "Acme builds software for teams of every size.");

        CompanyProfile profile = gate.validate(raw).profile();

        assertThat(profile.companyName()).isEqualTo("Acme Corp");
        assertThat(profile.logo()).isEqualTo("https://acme.com/logo.png");
        assertThat(profile.longDescription()).isEqualTo("Acme builds software for teams of every size.");
    }

    @Test
    void validationIsIdempotentOnAcceptedProfiles() {
        CompanyProfile first = gate.validate(raw("acme.com", "Software", "Technology")).profile();
        CompanyProfile second = gate.validate(first).profile();

        assertThat(second).isEqualTo(first);
    }

    private static Map<String, Object> raw(String domain, String industry, String sector) {
        Map<String, Object> raw = new HashMap<>();
        raw.put("domain", domain);
        raw.put("short_description", "Acme builds software.");
        raw.put("industry", industry);
        raw.put("sector", sector);
        return raw;
    }
}

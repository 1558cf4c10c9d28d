package com.companyintel.profiles.pipeline.quality;

import com.companyintel.profiles.pipeline.model.CompanyProfile;
import com.companyintel.profiles.pipeline.model.ValidationOutcome;
import com.companyintel.profiles.pipeline.util.DomainNames;
import com.companyintel.profiles.pipeline.util.ReasonCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Accept, repair or reject a candidate profile. Rejection rules run first and each one is
 * fatal to the item; repairs run only on profiles that passed every rejection rule.
 */
@Component
public class QualityGate {
    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public ValidationOutcome validate(Map<String, ?> raw) {
        return validate(ProfileSchema.coerce(raw));
    }

    public ValidationOutcome validate(CompanyProfile candidate) {
        CompanyProfile profile = ProfileSchema.coerce(candidate);

        String rejection = rejectionReason(profile);
        if (rejection != null) {
            log.debug("Rejected {}: {}", profile.domain(), rejection);
            return ValidationOutcome.rejected(profile.domain(), rejection);
        }
        return ValidationOutcome.accepted(repair(profile));
    }

    static String rejectionReason(CompanyProfile profile) {
        if (profile.shortDescription().isEmpty()) {
            return ReasonCodes.EMPTY_SHORT_DESCRIPTION;
        }
        String industry = profile.industry().toLowerCase(Locale.ROOT);
        if (industry.isEmpty() || industry.equals("unknown")) {
            return ReasonCodes.UNKNOWN_INDUSTRY;
        }
        if (profile.sector().isEmpty()) {
            return ReasonCodes.EMPTY_SECTOR;
        }
        return null;
    }

    static CompanyProfile repair(CompanyProfile profile) {
        CompanyProfile repaired = profile;
        if (repaired.companyName().isEmpty()) {
            repaired = repaired.withCompanyName(DomainNames.nameFromDomain(repaired.domain()));
        }
        if (repaired.longDescription().isEmpty()) {
            repaired = repaired.withLongDescription(repaired.shortDescription());
        }
        String logo = repaired.logo();
        if (!logo.isEmpty() && !(logo.startsWith("http://") || logo.startsWith("https://"))) {
            repaired = repaired.withLogo("");
        }
        return repaired;
    }
}

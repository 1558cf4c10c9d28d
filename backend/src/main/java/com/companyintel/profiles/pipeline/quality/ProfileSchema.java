package com.companyintel.profiles.pipeline.quality;

import com.companyintel.profiles.pipeline.model.CompanyProfile;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The fixed output schema and the single coercion routine used by both the quality gate and
 * the merger. Coercion is idempotent: {@code coerce(toMap(coerce(x))) == coerce(x)}.
 */
public final class ProfileSchema {
    public static final String DOMAIN = "domain";
    public static final String COMPANY_NAME = "company_name";
    public static final String LOGO = "logo";
    public static final String SHORT_DESCRIPTION = "short_description";
    public static final String LONG_DESCRIPTION = "long_description";
    public static final String SECTOR = "sector";
    public static final String INDUSTRY = "industry";
    public static final String SUB_INDUSTRY = "sub_industry";
    public static final String SIC_CODE = "sic_code";
    public static final String SIC_TEXT = "sic_text";
    public static final String TAGS = "tags";

    public static final List<String> FIELDS = List.of(
        DOMAIN,
        COMPANY_NAME,
        LOGO,
        SHORT_DESCRIPTION,
        LONG_DESCRIPTION,
        SECTOR,
        INDUSTRY,
        SUB_INDUSTRY,
        SIC_CODE,
        SIC_TEXT,
        TAGS
    );

    private ProfileSchema() {
    }

    /**
     * Missing keys and nulls become "", collections are comma-joined, other scalars are
     * stringified, everything is trimmed. Keys outside the schema are dropped.
     */
    public static CompanyProfile coerce(Map<String, ?> raw) {
        Map<String, ?> source = raw == null ? Map.of() : raw;
        return new CompanyProfile(
            field(source, DOMAIN),
            field(source, COMPANY_NAME),
            field(source, LOGO),
            field(source, SHORT_DESCRIPTION),
            field(source, LONG_DESCRIPTION),
            field(source, SECTOR),
            field(source, INDUSTRY),
            field(source, SUB_INDUSTRY),
            field(source, SIC_CODE),
            field(source, SIC_TEXT),
            field(source, TAGS)
        );
    }

    public static CompanyProfile coerce(CompanyProfile profile) {
        return coerce(toMap(profile));
    }

    public static Map<String, Object> toMap(CompanyProfile profile) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (profile == null) {
            return map;
        }
        map.put(DOMAIN, profile.domain());
        map.put(COMPANY_NAME, profile.companyName());
        map.put(LOGO, profile.logo());
        map.put(SHORT_DESCRIPTION, profile.shortDescription());
        map.put(LONG_DESCRIPTION, profile.longDescription());
        map.put(SECTOR, profile.sector());
        map.put(INDUSTRY, profile.industry());
        map.put(SUB_INDUSTRY, profile.subIndustry());
        map.put(SIC_CODE, profile.sicCode());
        map.put(SIC_TEXT, profile.sicText());
        map.put(TAGS, profile.tags());
        return map;
    }

    static String field(Map<String, ?> source, String key) {
        return coerceValue(source.get(key));
    }

    static String coerceValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text.trim();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                .filter(Objects::nonNull)
                .map(ProfileSchema::coerceValue)
                .filter(item -> !item.isEmpty())
                .collect(Collectors.joining(", "));
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty() ? "" : String.valueOf(map).trim();
        }
        return String.valueOf(value).trim();
    }
}

package com.companyintel.profiles.pipeline.classify;

import java.util.List;

public record IndustryRule(
    String name,
    List<String> keywords,
    String sicCode,
    String sicText
) {
}

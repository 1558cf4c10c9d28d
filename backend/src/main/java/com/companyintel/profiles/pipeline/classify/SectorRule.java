package com.companyintel.profiles.pipeline.classify;

import java.util.List;

/**
 * A sector with its keyword set and its industries, in declaration order. The first
 * industry is the fallback when no industry keyword matches.
 */
public record SectorRule(
    String name,
    List<String> keywords,
    List<IndustryRule> industries
) {
    public SectorRule {
        if (industries == null || industries.isEmpty()) {
            throw new IllegalArgumentException("sector " + name + " must declare at least one industry");
        }
    }
}

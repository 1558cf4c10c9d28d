package com.companyintel.profiles.pipeline.model;

import java.util.Map;

public record MergeStats(
    int total,
    Map<String, Integer> fieldCoverage,
    Map<String, Integer> sectorDistribution
) {
}

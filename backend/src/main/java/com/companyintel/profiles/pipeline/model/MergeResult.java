package com.companyintel.profiles.pipeline.model;

import java.util.List;

public record MergeResult(
    List<CompanyProfile> profiles,
    int inputCount,
    int duplicatesRemoved,
    MergeStats stats
) {
}

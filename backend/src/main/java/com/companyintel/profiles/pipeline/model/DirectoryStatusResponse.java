package com.companyintel.profiles.pipeline.model;

import java.time.Instant;

public record DirectoryStatusResponse(
    String service,
    int companiesLoaded,
    String dataFile,
    Instant loadedAt
) {
}

package com.companyintel.profiles.pipeline.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record PipelineRunSummary(
    Instant startedAt,
    Instant finishedAt,
    String status,
    int documentsFound,
    int acceptedCount,
    int failedCount,
    int rejectedCount,
    List<String> failedDomains,
    Map<String, Integer> failuresByReason,
    MergeStats acceptedStats,
    String rawOutputFile,
    String failedOutputFile,
    MergeSummary merge
) {
}

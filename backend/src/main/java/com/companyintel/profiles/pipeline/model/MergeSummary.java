package com.companyintel.profiles.pipeline.model;

public record MergeSummary(
    int inputCount,
    int outputCount,
    int duplicatesRemoved,
    MergeStats stats,
    String outputFile
) {
    public static MergeSummary of(MergeResult result, String outputFile) {
        return new MergeSummary(
            result.inputCount(),
            result.profiles().size(),
            result.duplicatesRemoved(),
            result.stats(),
            outputFile
        );
    }
}

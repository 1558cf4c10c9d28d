package com.companyintel.profiles.pipeline.model;

public record Descriptions(
    String shortDescription,
    String longDescription
) {
}

package com.companyintel.profiles.pipeline.model;

import java.nio.file.Path;

public record RawDocument(
    String domain,
    Path htmlPath
) {
}

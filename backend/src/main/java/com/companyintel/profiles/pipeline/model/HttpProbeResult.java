package com.companyintel.profiles.pipeline.model;

import java.time.Duration;

public record HttpProbeResult(
    String url,
    int statusCode,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public boolean isOk() {
        return statusCode == 200 && errorCode == null;
    }
}

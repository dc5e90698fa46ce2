package com.weatherlandscape.core.model;

import java.time.Instant;

public record ArtifactMetadata(
        Instant generatedAt,
        double lat,
        double lon,
        String zip,
        long byteSize,
        String formatVariant,
        String traceId
) {
}

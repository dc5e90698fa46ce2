package com.weatherlandscape.core.events;

import java.time.Instant;

public record ArtifactPublished(
        Instant timestamp,
        String key,
        String zip,
        String format,
        long byteSize,
        String traceId
) implements Event {
    @Override
    public String type() {
        return "ArtifactPublished";
    }
}

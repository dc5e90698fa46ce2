package com.weatherlandscape.core.message;

import com.weatherlandscape.core.format.FormatId;
import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.core.util.Zips;

import java.time.Instant;
import java.util.Objects;

public record GenerationJob(
        String zip,
        FormatId format,
        double lat,
        double lon,
        Instant enqueuedAt,
        TraceContext trace
) {
    public GenerationJob {
        zip = Zips.normalize(zip);
        Objects.requireNonNull(format, "format is required");
        Coordinates.check(lat, lon);
        Objects.requireNonNull(enqueuedAt, "enqueuedAt is required");
        Objects.requireNonNull(trace, "trace is required");
    }

    public String artifactKey() {
        return format.artifactKey(zip);
    }
}

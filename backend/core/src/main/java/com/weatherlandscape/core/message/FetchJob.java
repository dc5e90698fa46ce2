package com.weatherlandscape.core.message;

import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.core.util.Zips;

import java.time.Instant;
import java.util.Objects;

public record FetchJob(String zip, Instant scheduledAt, TraceContext trace) {
    public FetchJob {
        zip = Zips.normalize(zip);
        Objects.requireNonNull(scheduledAt, "scheduledAt is required");
        Objects.requireNonNull(trace, "trace is required");
    }
}

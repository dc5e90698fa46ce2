package com.weatherlandscape.core.message;

import com.weatherlandscape.core.trace.TraceContext;
import com.weatherlandscape.core.util.Zips;

import java.time.Instant;
import java.util.Objects;

public record WeatherReadyEvent(String zip, double lat, double lon, Instant fetchedAt, TraceContext trace) {
    public WeatherReadyEvent {
        zip = Zips.normalize(zip);
        Coordinates.check(lat, lon);
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        Objects.requireNonNull(trace, "trace is required");
    }
}

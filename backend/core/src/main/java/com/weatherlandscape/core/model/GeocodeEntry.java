package com.weatherlandscape.core.model;

import java.time.Instant;

public record GeocodeEntry(
        String zip,
        double lat,
        double lon,
        Instant cachedAt,
        String source
) {
}

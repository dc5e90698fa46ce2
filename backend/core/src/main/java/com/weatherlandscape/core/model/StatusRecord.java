package com.weatherlandscape.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record StatusRecord(
        String stage,
        Instant lastRunAt,
        Map<String, Integer> totals,
        int successCount,
        int errorCount,
        List<String> errors
) {
    public static final int MAX_ERRORS = 20;

    public StatusRecord {
        totals = totals == null ? Map.of() : Map.copyOf(totals);
        errors = errors == null ? List.of() : List.copyOf(errors.subList(Math.max(0, errors.size() - MAX_ERRORS), errors.size()));
    }
}

package com.weatherlandscape.core.events;

import java.time.Instant;

public record StageBatchCompleted(
        Instant timestamp,
        String stage,
        int successCount,
        int errorCount,
        long durationMillis
) implements Event {
    @Override
    public String type() {
        return "StageBatchCompleted";
    }

    public boolean success() {
        return errorCount == 0;
    }
}

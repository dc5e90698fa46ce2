package com.weatherlandscape.core.events;

import java.time.Instant;

public record StageBatchStarted(Instant timestamp, String stage, int messageCount) implements Event {
    @Override
    public String type() {
        return "StageBatchStarted";
    }
}
